package org.surff.pool;

/**
 * Thrown by {@link ThreadPool#execute(Job)} once the pool has started shutting down.
 */
public class PoolClosedException extends IllegalStateException {

    public PoolClosedException(String message) {
        super(message);
    }
}
