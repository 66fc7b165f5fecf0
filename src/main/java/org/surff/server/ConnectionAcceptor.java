package org.surff.server;

import org.surff.config.XmlConfiguration;
import org.surff.handlers.ConnectionHandler;
import org.surff.handlers.RequestRouter;
import org.surff.pool.PoolClosedException;
import org.surff.pool.ThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Owns the listening socket. Accepts connections one at a time on the calling
 * thread and hands each one to the pool as a {@link ConnectionHandler}.
 */
public class ConnectionAcceptor {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionAcceptor.class);

    private final XmlConfiguration.Server settings;
    private final ThreadPool pool;
    private final RequestRouter router;

    private volatile ServerSocket serverSocket;
    private volatile boolean stopped;

    public ConnectionAcceptor(XmlConfiguration.Server settings, ThreadPool pool, RequestRouter router) {
        if (settings == null) {
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        this.settings = settings;
        this.pool = pool;
        this.router = router;
    }

    public void bind() throws IOException {
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(settings.host, settings.port));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        this.serverSocket = socket;
        logger.info("Listening on {}:{}", settings.host, socket.getLocalPort());
    }

    public int localPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("acceptor is not bound");
        }
        return socket.getLocalPort();
    }

    /**
     * Runs the accept loop until {@link #stop()}, until the pool refuses work, or
     * until {@code maxConnections} connections were accepted when that is set.
     *
     * @return number of connections accepted
     */
    public int serve() {
        ServerSocket listener = serverSocket;
        if (listener == null) {
            throw new IllegalStateException("acceptor is not bound");
        }

        int accepted = 0;
        while (!stopped) {
            if (settings.maxConnections > 0 && accepted >= settings.maxConnections) {
                logger.info("Served {} connections; acceptor stopping", accepted);
                break;
            }

            Socket socket;
            try {
                socket = listener.accept();
            } catch (IOException e) {
                if (stopped || listener.isClosed()) break;
                logger.error("Accept failed: {}", e.getMessage(), e);
                continue;
            }

            accepted++;
            logger.debug("Connection established from {}", socket.getRemoteSocketAddress());
            try {
                pool.execute(new ConnectionHandler(socket, router,
                        settings.readBufferSize, settings.readTimeoutMillis));
            } catch (PoolClosedException e) {
                logger.warn("Pool is shut down; refusing {} and stopping", socket.getRemoteSocketAddress());
                closeSocket(socket);
                break;
            }
        }

        closeListener();
        return accepted;
    }

    /**
     * Closes the listening socket; a blocked {@link #serve()} returns.
     */
    public void stop() {
        stopped = true;
        closeListener();
    }

    private void closeListener() {
        ServerSocket socket = serverSocket;
        if (socket == null || socket.isClosed()) return;
        try {
            socket.close();
            logger.info("Listener on port {} closed", socket.getLocalPort());
        } catch (IOException e) {
            logger.warn("Error closing listener: {}", e.getMessage());
        }
    }

    private static void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.warn("Error closing refused connection: {}", e.getMessage());
        }
    }
}
