package org.surff.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.util.StatusPrinter;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Environment lookup for the server.
 * Responsibilities:
 *   1. Load environment (.env + system ENV)
 *   2. Initialize the matching Logback file (dev/prod)
 *   3. Resolve optional overrides such as SURFF_PORT
 * Priority for resolution:
 *     1. System environment variable
 *     2. .env file
 */
public class EnvProvider {

    private static final Logger logger = LoggerFactory.getLogger(EnvProvider.class);

    private static final String ENV_ENVIRONMENT = "APP_ENV";

    private static volatile boolean initialized = false;
    private static String activeEnv = "PRODUCTION";
    private static Dotenv dotenv;

    private EnvProvider() {}

    private static synchronized void init() {
        if (initialized) return;

        try {
            dotenv = Dotenv.configure()
                    .ignoreIfMalformed()
                    .ignoreIfMissing()
                    .load();

            String env = System.getenv(ENV_ENVIRONMENT);
            if (env == null || env.isBlank()) {
                env = dotenv.get(ENV_ENVIRONMENT, "PRODUCTION");
            }
            activeEnv = env.toUpperCase();

            if ("DEVELOPMENT".equals(activeEnv)) {
                loadLogback("logback-dev.xml");
            } else {
                loadLogback("logback.xml");
            }

            initialized = true;
            logger.info("Environment initialized: {}", activeEnv);

        } catch (Exception e) {
            throw new IllegalStateException("Failed initializing environment", e);
        }
    }

    /**
     * @return the trimmed value, or {@code null} when unset or blank
     */
    public static String get(String keyName) {
        if (!initialized) init();

        String value = System.getenv(keyName);
        if ((value == null || value.isBlank()) && dotenv != null) {
            value = dotenv.get(keyName);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static String getEnvironment() { if (!initialized) init(); return activeEnv; }

    private static void loadLogback(String fileName) {
        try (InputStream in = EnvProvider.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                logger.warn("Logback file {} not on classpath; keeping default configuration", fileName);
                return;
            }
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            ctx.reset();

            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(ctx);
            configurator.doConfigure(in);

            StatusPrinter.printInCaseOfErrorsOrWarnings(ctx);
        } catch (Exception e) {
            logger.error("Failed loading logback configuration {}: {}", fileName, e.getMessage(), e);
        }
    }
}
