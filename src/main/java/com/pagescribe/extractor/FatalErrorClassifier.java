package com.pagescribe.extractor;

/**
 * Decides whether a document failure is local to that document or systemic for the whole run.
 * Kept to a single method so the matching strategy can change (e.g. to structured error codes)
 * without touching the scheduler.
 */
@FunctionalInterface
public interface FatalErrorClassifier {

    /**
     * @param error failure raised while extracting one document
     * @return true if continuing would only repeat the failure for every remaining document
     */
    boolean isFatal(Throwable error);
}
