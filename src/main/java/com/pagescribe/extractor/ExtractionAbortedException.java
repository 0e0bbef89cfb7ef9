package com.pagescribe.extractor;

/**
 * Raised by the scheduler after a fatal error: outstanding work has been cancelled and every record
 * that completed before the abort has already been flushed.
 */
public class ExtractionAbortedException extends RuntimeException {

    private final transient SchedulerReport report;

    public ExtractionAbortedException(Throwable cause, SchedulerReport report) {
        super("Extraction run aborted: " + cause.getMessage(), cause);
        this.report = report;
    }

    /** Counters as they stood when the run was aborted. */
    public SchedulerReport getReport() {
        return report;
    }
}
