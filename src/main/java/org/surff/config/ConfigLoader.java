package org.surff.config;

import org.surff.config.utils.XmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 1998;
    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_READ_BUFFER = 1024;
    public static final int DEFAULT_READ_TIMEOUT_MILLIS = 30_000;
    public static final long DEFAULT_SLEEP_DELAY_MILLIS = 5000;

    static final String ENV_HOST = "SURFF_HOST";
    static final String ENV_PORT = "SURFF_PORT";
    static final String ENV_WORKERS = "SURFF_WORKERS";

    private ConfigLoader() {}

    /**
     * Loads the XML at {@code path}, or the bundled {@code config.xml} when the
     * file does not exist, then fills defaults and applies environment overrides.
     */
    public static XmlConfiguration loadConfig(String path) {
        return loadConfig(path, EnvProvider::get);
    }

    static XmlConfiguration loadConfig(String path, UnaryOperator<String> env) {
        XmlConfiguration cfg;
        try {
            cfg = read(path);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file " + path + ": " + e.getMessage(), e);
        }
        applyDefaults(cfg);
        applyOverrides(cfg, env);
        validate(cfg);
        return cfg;
    }

    private static XmlConfiguration read(String path) throws Exception {
        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                logger.debug("Reading configuration from {}", file.toAbsolutePath());
                return unmarshal(in);
            }
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream("config.xml")) {
            if (in == null) {
                logger.warn("No configuration at {} and none bundled; using defaults", path);
                return new XmlConfiguration();
            }
            logger.info("{} not found; using bundled config.xml", path);
            return unmarshal(in);
        }
    }

    private static XmlConfiguration unmarshal(InputStream in) throws Exception {
        Document doc = XmlUtil.parse(in);
        return XmlUtil.unmarshal(doc, XmlConfiguration.class);
    }

    static void applyDefaults(XmlConfiguration cfg) {
        if (cfg.server == null) cfg.server = new XmlConfiguration.Server();
        if (cfg.pool == null) cfg.pool = new XmlConfiguration.Pool();

        XmlConfiguration.Server server = cfg.server;
        if (server.host == null || server.host.isBlank()) server.host = DEFAULT_HOST;
        if (server.port == 0) server.port = DEFAULT_PORT;
        if (server.readBufferSize <= 0) server.readBufferSize = DEFAULT_READ_BUFFER;
        if (server.readTimeoutMillis <= 0) server.readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;
        if (server.sleepDelayMillis <= 0) server.sleepDelayMillis = DEFAULT_SLEEP_DELAY_MILLIS;
        if (server.contentRoot != null && server.contentRoot.isBlank()) server.contentRoot = null;

        XmlConfiguration.Pool pool = cfg.pool;
        if (pool.workerThreads == 0) pool.workerThreads = DEFAULT_WORKERS;
        if (pool.threadNamePrefix == null || pool.threadNamePrefix.isBlank()) {
            pool.threadNamePrefix = "surff-worker-";
        }
    }

    private static void applyOverrides(XmlConfiguration cfg, UnaryOperator<String> env) {
        String host = env.apply(ENV_HOST);
        if (host != null) cfg.server.host = host;

        String port = env.apply(ENV_PORT);
        if (port != null) cfg.server.port = parseInt(ENV_PORT, port);

        String workers = env.apply(ENV_WORKERS);
        if (workers != null) cfg.pool.workerThreads = parseInt(ENV_WORKERS, workers);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static void validate(XmlConfiguration cfg) {
        if (cfg.pool.workerThreads < 1) {
            throw new IllegalStateException("pool.workerThreads must be at least 1, got " + cfg.pool.workerThreads);
        }
        if (cfg.server.port < 0 || cfg.server.port > 65535) {
            throw new IllegalStateException("server.port out of range: " + cfg.server.port);
        }
        if (cfg.server.maxConnections < 0) {
            throw new IllegalStateException("server.maxConnections must not be negative");
        }
    }
}
