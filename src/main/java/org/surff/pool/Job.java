package org.surff.pool;

/**
 * A single unit of work handed to a {@link ThreadPool}.
 * Runs exactly once, on whichever worker dequeues it.
 */
@FunctionalInterface
public interface Job {
    void run();
}
