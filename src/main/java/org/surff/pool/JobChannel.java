package org.surff.pool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO queue of {@link Message}s between the submitting side of a
 * {@link ThreadPool} and its workers.
 * <p>
 * The queue has any number of {@link Sender} handles and one {@link Receiver}
 * that all workers share. A receive holds the channel lock, so only one worker
 * pulls from the queue at a time; the others park on the lock or on the
 * {@code notEmpty} condition. Every message is handed to exactly one
 * {@link Receiver#recv()} call.
 * <p>
 * Once every sender is closed the channel is disconnected. Messages already
 * queued are still delivered; after that {@code recv()} throws
 * {@link ChannelDisconnectedException}.
 */
public final class JobChannel {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<Message> queue = new ArrayDeque<>();
    private int openSenders;

    private final Sender sender;
    private final Receiver receiver;

    private JobChannel() {
        this.openSenders = 1;
        this.sender = new Sender();
        this.receiver = new Receiver();
    }

    public static JobChannel open() {
        return new JobChannel();
    }

    public Sender sender() {
        return sender;
    }

    public Receiver receiver() {
        return receiver;
    }

    /**
     * Sending handle. Handles are cheap; {@link #copy()} hands out another one
     * bound to the same queue.
     */
    public final class Sender implements AutoCloseable {
        private boolean closed;

        private Sender() {}

        public void send(Message message) {
            Objects.requireNonNull(message, "message");
            lock.lock();
            try {
                if (closed) {
                    throw new ChannelDisconnectedException("send on a closed sender");
                }
                queue.addLast(message);
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }

        public Sender copy() {
            lock.lock();
            try {
                if (closed) {
                    throw new ChannelDisconnectedException("copy of a closed sender");
                }
                openSenders++;
                return new Sender();
            } finally {
                lock.unlock();
            }
        }

        public boolean isClosed() {
            lock.lock();
            try {
                return closed;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            lock.lock();
            try {
                if (closed) return;
                closed = true;
                if (--openSenders == 0) {
                    // wake every parked receiver so it can observe the disconnect
                    notEmpty.signalAll();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Receiving handle shared by all workers of a pool.
     */
    public final class Receiver {

        private Receiver() {}

        /**
         * Blocks until a message is available and removes it from the head of the queue.
         *
         * @throws ChannelDisconnectedException if the queue is empty and no sender is left
         */
        public Message recv() {
            lock.lock();
            try {
                while (queue.isEmpty()) {
                    if (openSenders == 0) {
                        throw new ChannelDisconnectedException("all senders closed");
                    }
                    // workers only leave on Terminate or disconnect, not on interrupt
                    notEmpty.awaitUninterruptibly();
                }
                return queue.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        public int pending() {
            lock.lock();
            try {
                return queue.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
