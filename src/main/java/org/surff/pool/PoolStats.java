package org.surff.pool;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Point-in-time view of a {@link ThreadPool}.
 *
 * @param size        configured worker count
 * @param liveWorkers worker threads still running
 * @param submitted   jobs accepted by {@code execute}
 * @param completed   jobs that returned normally
 * @param failed      jobs that threw
 * @param pending     messages still waiting in the channel
 */
public record PoolStats(int size, int liveWorkers, long submitted, long completed, long failed, int pending) {

    /**
     * Running totals shared between a pool and its workers.
     */
    public static final class Counters {
        final AtomicLong submitted = new AtomicLong();
        final AtomicLong completed = new AtomicLong();
        final AtomicLong failed = new AtomicLong();

        public long submitted() { return submitted.get(); }
        public long completed() { return completed.get(); }
        public long failed() { return failed.get(); }
    }
}
