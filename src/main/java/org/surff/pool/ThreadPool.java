package org.surff.pool;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-size pool of worker threads fed from one unbounded {@link JobChannel}.
 * <p>
 * All workers are started by the constructor and live until {@link #close()}.
 * {@link #execute(Job)} never waits for capacity. Which worker runs a job is
 * not defined; jobs leave the queue in submission order.
 * <p>
 * {@code close()} sends one {@link Message.Terminate} per worker and then joins
 * every worker thread, so it returns only when none is left running. Jobs
 * accepted by {@code execute} are all queued ahead of the terminate messages,
 * so they run before {@code close()} returns; later calls are refused. The
 * pool cannot be reopened.
 *
 * <pre>{@code
 * try (ThreadPool pool = new ThreadPool(4)) {
 *     pool.execute(() -> handle(socket));
 * }
 * }</pre>
 */
public class ThreadPool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

    public static final String DEFAULT_NAME_PREFIX = "surff-worker-";

    private final List<Worker> workers;
    private final JobChannel.Sender sender;
    private final JobChannel.Receiver receiver;
    private final PoolStats.Counters counters = new PoolStats.Counters();
    // guards the closed flag together with enqueueing, so no job lands behind the terminate messages
    private final Object submitLock = new Object();
    private volatile boolean closed;

    public ThreadPool(int size) {
        this(size, DEFAULT_NAME_PREFIX);
    }

    /**
     * @param size       number of worker threads, at least 1
     * @param namePrefix worker threads are named {@code namePrefix + id}
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public ThreadPool(int size, String namePrefix) {
        if (size <= 0) {
            throw new IllegalArgumentException("pool size must be positive: " + size);
        }
        Objects.requireNonNull(namePrefix, "namePrefix");

        JobChannel channel = JobChannel.open();
        this.sender = channel.sender();
        this.receiver = channel.receiver();

        List<Worker> list = new ArrayList<>(size);
        for (int id = 0; id < size; id++) {
            list.add(Worker.spawn(id, receiver, counters, namePrefix));
        }
        this.workers = Collections.unmodifiableList(list);
        logger.info("Thread pool started with {} workers", size);
    }

    /**
     * Queues a job for one of the workers.
     *
     * @throws PoolClosedException once {@link #close()} has been called
     */
    public void execute(Job job) {
        Objects.requireNonNull(job, "job");
        synchronized (submitLock) {
            if (closed) {
                throw new PoolClosedException("thread pool is shut down");
            }
            counters.submitted.incrementAndGet();
            sender.send(Message.job(job));
        }
    }

    /**
     * Stops every worker and waits for all of them to exit. Safe to call more
     * than once; only the first call does anything. An interrupt received while
     * waiting does not cut the wait short, it is restored before returning.
     *
     * @throws IllegalStateException if called from one of this pool's workers, which could never be joined
     */
    @Override
    public void close() {
        for (Worker worker : workers) {
            if (worker.isCurrentThread()) {
                throw new IllegalStateException("close() called from worker " + worker.id());
            }
        }
        shutdown();
    }

    private synchronized void shutdown() {
        synchronized (submitLock) {
            if (closed) return;
            closed = true;

            logger.info("Sending terminate message to all workers.");
            for (int i = 0; i < workers.size(); i++) {
                sender.send(Message.terminate());
            }
        }

        logger.info("Shutting down all workers.");
        boolean interrupted = false;
        for (Worker worker : workers) {
            logger.info("Shutting down worker {}", worker.id());
            while (!worker.isJoined()) {
                try {
                    worker.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        sender.close();

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.info("Thread pool shut down; {} jobs completed, {} failed",
                counters.completed(), counters.failed());
    }

    public int size() {
        return workers.size();
    }

    public int liveWorkers() {
        int alive = 0;
        for (Worker worker : workers) {
            if (worker.isAlive()) alive++;
        }
        return alive;
    }

    public boolean isClosed() {
        return closed;
    }

    @NotNull
    public PoolStats stats() {
        return new PoolStats(size(), liveWorkers(), counters.submitted(),
                counters.completed(), counters.failed(), receiver.pending());
    }

    List<Worker> workers() {
        return workers;
    }
}
