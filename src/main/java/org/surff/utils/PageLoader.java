package org.surff.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads the static pages served by the router.
 * A page in the content root wins; otherwise the copy bundled under {@code pages/} on the classpath is used.
 */
public class PageLoader {
    private static final Logger logger = LoggerFactory.getLogger(PageLoader.class);

    private final Path contentRoot;
    private final Map<String, byte[]> bundled = new ConcurrentHashMap<>();

    /**
     * @param contentRoot directory to look in first, may be {@code null}
     */
    public PageLoader(@Nullable Path contentRoot) {
        this.contentRoot = contentRoot;
    }

    @NotNull
    public byte[] load(String name) throws IOException {
        if (contentRoot != null) {
            Path file = contentRoot.resolve(name).normalize();
            if (file.startsWith(contentRoot.normalize()) && Files.isRegularFile(file)) {
                return Files.readAllBytes(file);
            }
            logger.debug("{} not in {}; falling back to bundled page", name, contentRoot);
        }

        // callers get a copy; the cached page is shared by every request
        byte[] cached = bundled.get(name);
        if (cached != null) return cached.clone();

        try (InputStream in = PageLoader.class.getClassLoader().getResourceAsStream("pages/" + name)) {
            if (in == null) {
                throw new FileNotFoundException("page not found: " + name);
            }
            byte[] bytes = in.readAllBytes();
            bundled.put(name, bytes);
            return bytes.clone();
        }
    }
}
