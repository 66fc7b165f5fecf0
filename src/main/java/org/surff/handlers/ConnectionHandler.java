package org.surff.handlers;

import org.surff.config.utils.LogContext;
import org.surff.pool.Job;
import org.surff.utils.HttpRequestUtil;
import org.surff.utils.Response;
import org.surff.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;

/**
 * Job for one accepted connection: read the request once, answer it, close the socket.
 * I/O failures, read timeouts included, are logged and the connection dropped;
 * nothing escapes to the worker.
 */
public class ConnectionHandler implements Job {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Socket socket;
    private final RequestRouter router;
    private final int readBufferSize;
    private final int readTimeoutMillis;

    /**
     * @param readTimeoutMillis a peer silent for this long is dropped
     */
    public ConnectionHandler(Socket socket, RequestRouter router, int readBufferSize, int readTimeoutMillis) {
        this.socket = socket;
        this.router = router;
        this.readBufferSize = readBufferSize;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    @Override
    public void run() {
        SocketAddress remote = socket.getRemoteSocketAddress();
        LogContext.startConnection("ConnectionHandler", remote);
        try (Socket s = socket;
             InputStream in = s.getInputStream();
             OutputStream out = s.getOutputStream()) {

            s.setSoTimeout(readTimeoutMillis);
            byte[] buffer = new byte[readBufferSize];
            int read = in.read(buffer);
            if (read < 0) {
                logger.debug("{} closed before sending a request", remote);
                return;
            }
            logger.debug("Request from {}: {}", remote, HttpRequestUtil.requestLine(buffer, read));

            Response response = router.route(buffer, read);
            ResponseUtil.send(out, response);
            logger.info("{} {} -> {}", remote, HttpRequestUtil.requestLine(buffer, read), response.statusLine());

        } catch (IOException e) {
            logger.warn("Dropping connection {}: {}", remote, e.getMessage());
        } finally {
            LogContext.clear();
        }
    }
}
