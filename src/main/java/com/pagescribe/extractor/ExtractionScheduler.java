package com.pagescribe.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every document extraction as its own task under a concurrency bound and streams the results to the
 * dataset in completion order.
 * <p>
 * Workflow:
 * <ul>
 *   <li>All tasks are submitted up front to a fixed pool, so cancellation can reach each of them.</li>
 *   <li>A semaphore of the same capacity gates every extraction body; queueing beyond it is left to the pool.</li>
 *   <li>The calling thread drains results as they complete and is the only thread that touches the batch
 *       and the header flag.</li>
 *   <li>The batch is flushed whenever it reaches {@code flushEvery} records, and once more at the end if
 *       anything is left, so memory stays bounded by the flush threshold.</li>
 *   <li>On a fatal error every unfinished task is cancelled, records that already completed are still
 *       flushed, and {@link ExtractionAbortedException} is thrown.</li>
 * </ul>
 * A hung extraction holds its permit indefinitely; there is no timeout here.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class ExtractionScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionScheduler.class);

    private final DatasetServiceInterface datasets;
    private final FatalErrorClassifier classifier;
    private final int flushEvery;

    public ExtractionScheduler(DatasetServiceInterface datasets, FatalErrorClassifier classifier, int flushEvery) {
        if (flushEvery < 1) {
            throw new ConfigurationException("flushEvery must be >= 1, got " + flushEvery);
        }
        this.datasets = datasets;
        this.classifier = classifier;
        this.flushEvery = flushEvery;
    }

    /**
     * Extracts every document and appends the successful records to {@code target}.
     * @param refs documents to extract
     * @param concurrency maximum number of extraction bodies running at once; must be at least 1
     * @param extractor extraction function
     * @param target dataset file, its format and header state
     * @param log run log
     * @return counters of the run
     * @throws ExtractionAbortedException after a fatal error, once completed records are flushed
     * @throws IOException if a flush fails; outstanding tasks are cancelled first
     */
    public SchedulerReport run(List<String> refs, int concurrency, DocumentExtractor extractor,
                               DatasetTarget target, RunLogger log) throws IOException {
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be >= 1, got " + concurrency);
        }
        if (refs.isEmpty()) {
            log.log("No documents to extract");
            return SchedulerReport.empty(target.headerWritten());
        }
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, workerThreads());
        try {
            return drain(refs, concurrency, extractor, target, log, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private SchedulerReport drain(List<String> refs, int concurrency, DocumentExtractor extractor,
                                  DatasetTarget target, RunLogger log, ExecutorService pool) throws IOException {
        CompletionService<Optional<ExtractedRecord>> completion = new ExecutorCompletionService<>(pool);
        Semaphore permits = new Semaphore(concurrency);
        AtomicBoolean aborted = new AtomicBoolean(false);

        List<Future<Optional<ExtractedRecord>>> futures = new ArrayList<>(refs.size());
        for (String ref : refs) {
            futures.add(completion.submit(new ExtractionTask(ref, extractor, classifier, permits, aborted, log)));
        }
        log.log("Dispatched " + refs.size() + " document(s) with concurrency " + concurrency);

        Drain state = new Drain(target.headerWritten());
        Throwable fatal = null;
        try {
            while (state.drained < refs.size()) {
                Future<Optional<ExtractedRecord>> done = completion.take();
                fatal = state.accept(done);
                if (fatal != null) {
                    break;
                }
                if (state.batch.size() >= flushEvery) {
                    flush(state, target, log, refs.size());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fatal = e;
        } catch (IOException | RuntimeException e) {
            cancelOutstanding(futures, aborted);
            throw e;
        }

        if (fatal != null) {
            int cancelled = cancelOutstanding(futures, aborted);
            logger.warn("Cancelled {} outstanding extraction task(s)", cancelled);
            harvest(futures, state);
        }
        if (!state.batch.isEmpty()) {
            flush(state, target, log, refs.size());
        }

        SchedulerReport report = state.report(refs.size());
        if (fatal != null) {
            log.log("Run aborted after " + report.succeeded() + " record(s); " + report.skipped() + " document(s) not processed");
            throw new ExtractionAbortedException(fatal, report);
        }
        log.log("Extraction finished: " + report.succeeded() + " record(s), " + report.failed() + " failure(s), "
            + report.flushes() + " flush(es)");
        return report;
    }

    private void flush(Drain state, DatasetTarget target, RunLogger log, int total) throws IOException {
        state.headerWritten = datasets.flush(List.copyOf(state.batch), target.path(), state.headerWritten, target.format());
        state.flushes++;
        state.batch.clear();
        log.log("Progress: " + state.drained + "/" + total + " drained, " + state.succeeded + " record(s) written");
    }

    /**
     * Collects every task the loop had not drained yet. All of them are done or cancelled by now; records of
     * tasks that finished before the cancellation reached them are kept.
     */
    private static void harvest(List<Future<Optional<ExtractedRecord>>> futures, Drain state) {
        for (Future<Optional<ExtractedRecord>> f : futures) {
            if (!state.seen.contains(f)) {
                state.accept(f);
            }
        }
    }

    private static int cancelOutstanding(List<Future<Optional<ExtractedRecord>>> futures, AtomicBoolean aborted) {
        aborted.set(true);
        int cancelled = 0;
        for (Future<Optional<ExtractedRecord>> f : futures) {
            if (!f.isDone() && f.cancel(true)) cancelled++;
        }
        return cancelled;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "extract-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** Mutable drain-loop state. Only the draining thread reads or writes it. */
    private static final class Drain {
        final List<ExtractedRecord> batch = new ArrayList<>();
        final Set<Future<Optional<ExtractedRecord>>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        boolean headerWritten;
        int drained;
        int succeeded;
        int failed;
        int skipped;
        int flushes;

        Drain(boolean headerWritten) {
            this.headerWritten = headerWritten;
        }

        /**
         * Records one completed task.
         * @return the fatal cause if this task aborts the run, otherwise null
         */
        Throwable accept(Future<Optional<ExtractedRecord>> done) {
            if (!seen.add(done)) {
                return null;
            }
            drained++;
            if (done.isCancelled()) {
                skipped++;
                return null;
            }
            try {
                Optional<ExtractedRecord> result = done.get();
                if (result.isPresent()) {
                    batch.add(result.get());
                    succeeded++;
                } else {
                    failed++;
                }
                return null;
            } catch (CancellationException e) {
                skipped++;
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                skipped++;
                return e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof CancellationException || cause instanceof InterruptedException) {
                    skipped++;
                    return null;
                }
                failed++;
                return cause;
            }
        }

        SchedulerReport report(int dispatched) {
            return new SchedulerReport(dispatched, succeeded, failed, skipped, flushes, headerWritten);
        }
    }
}
