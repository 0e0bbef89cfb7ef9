package com.pagescribe.extractor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Extraction of a single document, as scheduled by {@link ExtractionScheduler}.
 * <p>
 * The body runs only while holding a permit of the run's semaphore. A successful call yields a record
 * stamped with {@code file_name} and {@code generation_seconds}. A failure is classified before it is
 * swallowed: document-local failures are logged and yield {@link Optional#empty()}, fatal ones raise the
 * run's abort flag and are rethrown as {@link FatalExtractionException}. Once the flag is up, tasks that
 * acquire a permit afterwards end with {@link CancellationException} without calling the extractor.
 */
final class ExtractionTask implements Callable<Optional<ExtractedRecord>> {

    private final String documentRef;
    private final DocumentExtractor extractor;
    private final FatalErrorClassifier classifier;
    private final Semaphore permits;
    private final AtomicBoolean aborted;
    private final RunLogger log;

    ExtractionTask(String documentRef, DocumentExtractor extractor, FatalErrorClassifier classifier,
                   Semaphore permits, AtomicBoolean aborted, RunLogger log) {
        this.documentRef = documentRef;
        this.extractor = extractor;
        this.classifier = classifier;
        this.permits = permits;
        this.aborted = aborted;
        this.log = log;
    }

    @Override
    public Optional<ExtractedRecord> call() throws InterruptedException {
        permits.acquire();
        try {
            if (aborted.get()) {
                throw new CancellationException("Run aborted before " + documentRef + " started");
            }
            long start = System.nanoTime();
            Map<String, Object> fields;
            try {
                fields = extractor.extract(documentRef);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                return handleFailure(e);
            }
            if (fields == null) {
                log.log("Extractor returned no record for " + documentRef);
                return Optional.empty();
            }
            Map<String, Object> stamped = new LinkedHashMap<>(fields);
            stamped.put(ExtractedRecord.GENERATION_SECONDS, seconds(System.nanoTime() - start));
            return Optional.of(ExtractedRecord.of(documentRef, stamped));
        } finally {
            permits.release();
        }
    }

    private Optional<ExtractedRecord> handleFailure(Exception e) {
        if (aborted.get()) {
            // in flight when another document aborted the run
            throw new CancellationException("Run aborted while extracting " + documentRef);
        }
        if (classifier.isFatal(e)) {
            aborted.set(true);
            log.log("Fatal error while extracting " + documentRef + ", aborting run", e);
            throw new FatalExtractionException(documentRef, e);
        }
        log.log("Failed to extract " + documentRef, e);
        return Optional.empty();
    }

    private static double seconds(long nanos) {
        return Math.round(nanos / 1_000_000.0) / 1000.0;
    }
}
