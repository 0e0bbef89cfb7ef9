package com.pagescribe.extractor;

/**
 * Counters of one scheduler run.
 *
 * @param dispatched tasks created
 * @param succeeded records produced (all of them flushed)
 * @param failed documents that failed locally and were logged
 * @param skipped tasks cancelled or never started because of an abort
 * @param flushes writer invocations
 * @param headerWritten header state after the last flush
 */
public record SchedulerReport(int dispatched, int succeeded, int failed, int skipped, int flushes, boolean headerWritten) {

    public static SchedulerReport empty(boolean headerWritten) {
        return new SchedulerReport(0, 0, 0, 0, 0, headerWritten);
    }
}
