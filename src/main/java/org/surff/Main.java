package org.surff;

import org.surff.config.ConfigLoader;
import org.surff.config.EnvProvider;
import org.surff.config.XmlConfiguration;
import org.surff.config.utils.LogContext;
import org.surff.handlers.HealthRoute;
import org.surff.handlers.RequestRouter;
import org.surff.pool.ThreadPool;
import org.surff.server.ConnectionAcceptor;
import org.surff.utils.PageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Entry point
 * Load Configuration from Xml
 * Start the worker pool
 * Accept connections until stopped
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Instant startedAt = Instant.now();
        LogContext.start("Main");

        try {
            logger.info("[------------ Starting surff ({}) ------------]", EnvProvider.getEnvironment());

            String configPath = (args.length > 0) ? args[0] : "config.xml";
            XmlConfiguration cfg = ConfigLoader.loadConfig(configPath);
            logger.debug("Configuration loaded from {}", configPath);

            ThreadPool pool = new ThreadPool(cfg.pool.workerThreads, cfg.pool.threadNamePrefix);
            Path contentRoot = cfg.server.contentRoot != null ? Path.of(cfg.server.contentRoot) : null;
            RequestRouter router = new RequestRouter(new PageLoader(contentRoot),
                    cfg.server.sleepDelayMillis, new HealthRoute(pool, startedAt));

            ConnectionAcceptor acceptor = new ConnectionAcceptor(cfg.server, pool, router);
            acceptor.bind();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("[------------ Shutdown initiated ------------]");
                acceptor.stop();
                pool.close();
                logger.info("[------------ surff shutdown complete ------------]");
            }, "surff-shutdown"));

            logger.info("""

                    surff
                    --------------------------------------
                    Listening : http://{}:{}
                    Workers   : {}
                    """, cfg.server.host, acceptor.localPort(), pool.size());

            int served = acceptor.serve();
            logger.info("Acceptor finished after {} connections", served);
            pool.close();

        } catch (Exception e) {
            logger.error("[------------ surff failed: {} ------------]", e.getMessage(), e);
            System.exit(1);
        } finally {
            LogContext.clear();
        }
    }
}
