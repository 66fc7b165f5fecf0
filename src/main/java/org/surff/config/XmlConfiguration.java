package org.surff.config;

import jakarta.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public Pool pool;

    // --- TCP listener and request handling ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host;
        public int port;
        /** 0 = serve until stopped */
        public int maxConnections;
        public int readBufferSize;
        /** how long a job waits for the request before dropping the connection */
        public int readTimeoutMillis;
        public long sleepDelayMillis;
        /** directory holding hello.html and 404.html; classpath pages when empty */
        public String contentRoot;
    }

    // --- Worker pool ---
    @XmlRootElement(name = "pool")
    public static class Pool {
        public int workerThreads;
        public String threadNamePrefix;
    }
}
