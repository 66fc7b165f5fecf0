package org.surff.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One long-lived thread of a {@link ThreadPool}.
 * <p>
 * The thread pulls messages from the shared {@link JobChannel.Receiver} one at a
 * time. A {@link Message.NewJob} is run to completion on this thread; a
 * {@link Message.Terminate}, or a disconnected channel, ends the loop.
 * <p>
 * Jobs are attempted once. An {@link Exception} thrown by a job is logged and
 * counted and the worker moves on to its next message. An {@link Error} is
 * counted and rethrown: the thread dies and the pool keeps running one worker
 * short. Nothing respawns it.
 */
public final class Worker {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final int id;
    private final JobChannel.Receiver receiver;
    private final PoolStats.Counters counters;
    private volatile Thread thread;

    private Worker(int id, JobChannel.Receiver receiver, PoolStats.Counters counters) {
        this.id = id;
        this.receiver = receiver;
        this.counters = counters;
    }

    /**
     * Starts the worker thread and returns its handle.
     */
    public static Worker spawn(int id, JobChannel.Receiver receiver, PoolStats.Counters counters, String namePrefix) {
        Worker worker = new Worker(id, receiver, counters);
        Thread t = new Thread(worker::runLoop, namePrefix + id);
        t.setUncaughtExceptionHandler((th, e) ->
                logger.error("Worker {} died on {}; pool continues without it", id, e.toString(), e));
        worker.thread = t;
        t.start();
        return worker;
    }

    private void runLoop() {
        while (true) {
            Message message;
            try {
                message = receiver.recv();
            } catch (ChannelDisconnectedException e) {
                logger.info("Worker {} disconnected; shutting down.", id);
                return;
            }

            if (message instanceof Message.NewJob newJob) {
                logger.debug("Worker {} got a job; executing.", id);
                runJob(newJob.job());
            } else {
                logger.info("Worker {} was told to terminate.", id);
                return;
            }
        }
    }

    private void runJob(Job job) {
        // an interrupt left behind by the previous job must not reach this one
        Thread.interrupted();
        try {
            job.run();
            counters.completed.incrementAndGet();
        } catch (Exception e) {
            counters.failed.incrementAndGet();
            logger.error("Worker {} job failed: {}", id, e.getMessage(), e);
        } catch (Error e) {
            counters.failed.incrementAndGet();
            throw e;
        }
    }

    public int id() {
        return id;
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    /**
     * Waits for the thread to finish. The handle is consumed by the first
     * successful join; later calls return at once.
     */
    public void join() throws InterruptedException {
        Thread t = thread;
        if (t == null) return;
        t.join();
        thread = null;
    }

    boolean isCurrentThread() {
        return Thread.currentThread() == thread;
    }

    boolean isJoined() {
        return thread == null;
    }
}
