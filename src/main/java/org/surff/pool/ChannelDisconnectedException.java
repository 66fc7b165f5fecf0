package org.surff.pool;

/**
 * The other side of a {@link JobChannel} is gone.
 * On the receiving side this only happens once the queue is empty.
 */
public class ChannelDisconnectedException extends RuntimeException {

    public ChannelDisconnectedException(String message) {
        super(message);
    }
}
