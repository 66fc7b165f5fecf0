package org.surff.config;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

/**
 * Unit tests for ConfigLoader.
 */
public class ConfigLoaderTest {

    private File tempDir;
    private final Map<String, String> env = new HashMap<>();

    @Before
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("surff-config-test").toFile();
    }

    @After
    public void tearDown() {
        if (tempDir != null && tempDir.exists()) {
            File[] children = tempDir.listFiles();
            if (children != null) {
                for (File child : children) {
                    child.delete();
                }
            }
            tempDir.delete();
        }
    }

    private String createConfigFile(String content) throws IOException {
        File file = new File(tempDir, "config.xml");
        try (FileWriter writer = new FileWriter(file)) {
            writer.write(content);
        }
        return file.getPath();
    }

    private XmlConfiguration load(String path) {
        return ConfigLoader.loadConfig(path, env::get);
    }

    @Test
    public void testFullConfiguration() throws Exception {
        String path = createConfigFile("<?xml version=\"1.0\"?>\n" +
                "<configuration>\n" +
                "  <server>\n" +
                "    <host>127.0.0.1</host>\n" +
                "    <port>7879</port>\n" +
                "    <maxConnections>2</maxConnections>\n" +
                "    <readBufferSize>512</readBufferSize>\n" +
                "    <readTimeoutMillis>1500</readTimeoutMillis>\n" +
                "    <sleepDelayMillis>250</sleepDelayMillis>\n" +
                "    <contentRoot>/srv/www</contentRoot>\n" +
                "  </server>\n" +
                "  <pool>\n" +
                "    <workerThreads>8</workerThreads>\n" +
                "    <threadNamePrefix>web-</threadNamePrefix>\n" +
                "  </pool>\n" +
                "</configuration>");

        XmlConfiguration cfg = load(path);

        assertEquals("127.0.0.1", cfg.server.host);
        assertEquals(7879, cfg.server.port);
        assertEquals(2, cfg.server.maxConnections);
        assertEquals(512, cfg.server.readBufferSize);
        assertEquals(1500, cfg.server.readTimeoutMillis);
        assertEquals(250, cfg.server.sleepDelayMillis);
        assertEquals("/srv/www", cfg.server.contentRoot);
        assertEquals(8, cfg.pool.workerThreads);
        assertEquals("web-", cfg.pool.threadNamePrefix);
    }

    @Test
    public void testMissingSectionsGetDefaults() throws Exception {
        String path = createConfigFile("<?xml version=\"1.0\"?>\n<configuration></configuration>");

        XmlConfiguration cfg = load(path);

        assertEquals(ConfigLoader.DEFAULT_HOST, cfg.server.host);
        assertEquals(ConfigLoader.DEFAULT_PORT, cfg.server.port);
        assertEquals(0, cfg.server.maxConnections);
        assertEquals(ConfigLoader.DEFAULT_READ_BUFFER, cfg.server.readBufferSize);
        assertEquals(ConfigLoader.DEFAULT_READ_TIMEOUT_MILLIS, cfg.server.readTimeoutMillis);
        assertEquals(ConfigLoader.DEFAULT_SLEEP_DELAY_MILLIS, cfg.server.sleepDelayMillis);
        assertNull(cfg.server.contentRoot);
        assertEquals(ConfigLoader.DEFAULT_WORKERS, cfg.pool.workerThreads);
        assertEquals("surff-worker-", cfg.pool.threadNamePrefix);
    }

    @Test
    public void testMissingFileFallsBackToBundledConfig() {
        XmlConfiguration cfg = load(new File(tempDir, "absent.xml").getPath());

        assertEquals(1998, cfg.server.port);
        assertEquals(4, cfg.pool.workerThreads);
        assertNull(cfg.server.contentRoot);
    }

    @Test
    public void testEnvironmentOverrides() throws Exception {
        String path = createConfigFile("<?xml version=\"1.0\"?>\n" +
                "<configuration><server><port>7000</port></server>" +
                "<pool><workerThreads>2</workerThreads></pool></configuration>");
        env.put(ConfigLoader.ENV_HOST, "localhost");
        env.put(ConfigLoader.ENV_PORT, "9090");
        env.put(ConfigLoader.ENV_WORKERS, "6");

        XmlConfiguration cfg = load(path);

        assertEquals("localhost", cfg.server.host);
        assertEquals(9090, cfg.server.port);
        assertEquals(6, cfg.pool.workerThreads);
    }

    @Test(expected = IllegalStateException.class)
    public void testNonNumericOverrideRejected() {
        env.put(ConfigLoader.ENV_WORKERS, "many");
        load(new File(tempDir, "absent.xml").getPath());
    }

    @Test(expected = IllegalStateException.class)
    public void testNegativeWorkerCountRejected() throws Exception {
        String path = createConfigFile("<?xml version=\"1.0\"?>\n" +
                "<configuration><pool><workerThreads>-1</workerThreads></pool></configuration>");
        load(path);
    }

    @Test
    public void testMalformedXmlRejected() throws Exception {
        String path = createConfigFile("<configuration><server>");
        try {
            load(path);
            fail("expected failure");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().startsWith("Failed to load config file"));
            assertNotNull(e.getCause());
        }
    }
}
