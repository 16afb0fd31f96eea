package com.aicmd.cache.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StoreLocationResolver {
    private static final Logger log = LoggerFactory.getLogger(StoreLocationResolver.class);
    static final String USER_DIR_NAME = ".ai-cmd";
    static final String TEMP_DIR_NAME = "ai-cmd";

    private final StoreProperties properties;
    private final String userHome;
    private final String tempDir;

    public StoreLocationResolver(StoreProperties properties) {
        this(properties, System.getProperty("user.home"), System.getProperty("java.io.tmpdir"));
    }

    StoreLocationResolver(StoreProperties properties, String userHome, String tempDir) {
        this.properties = properties;
        this.userHome = userHome;
        this.tempDir = tempDir;
    }

    public StoreLocation resolveLocation() {
        if (!properties.isEnabled()) {
            log.info("cache store disabled by configuration");
            return StoreLocation.unavailable();
        }
        String fileName = properties.getDatabaseFile() == null || properties.getDatabaseFile().isBlank()
            ? "cache.db"
            : properties.getDatabaseFile();

        Path configured = toPath(expandHome(properties.getDirectory()));
        if (configured != null && isWritableDirectory(configured)) {
            return new StoreLocation(configured.resolve(fileName), StoreLocation.Source.CONFIGURED);
        }
        Path home = userHome == null ? null : toPath(userHome);
        if (home != null) {
            Path userDir = home.resolve(USER_DIR_NAME);
            if (isWritableDirectory(userDir)) {
                return new StoreLocation(userDir.resolve(fileName), StoreLocation.Source.USER_HOME);
            }
        }
        Path temp = tempDir == null ? null : toPath(tempDir);
        if (temp != null) {
            Path tempCacheDir = temp.resolve(TEMP_DIR_NAME);
            if (isWritableDirectory(tempCacheDir)) {
                log.warn("falling back to temp directory for cache store dir={}", tempCacheDir);
                return new StoreLocation(tempCacheDir.resolve(fileName), StoreLocation.Source.TEMP);
            }
        }
        log.warn("no writable location for cache store; caching unavailable");
        return StoreLocation.unavailable();
    }

    boolean isWritableDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
            if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
                return false;
            }
            Path marker = Files.createTempFile(dir, ".write-check", ".tmp");
            Files.deleteIfExists(marker);
            return true;
        } catch (IOException | SecurityException ex) {
            log.debug("cache directory not usable dir={} error={}", dir, ex.getMessage());
            return false;
        }
    }

    private String expandHome(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if ((trimmed.equals("~") || trimmed.startsWith("~/")) && userHome != null) {
            return userHome + trimmed.substring(1);
        }
        return trimmed;
    }

    private Path toPath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Paths.get(value);
        } catch (InvalidPathException ex) {
            log.debug("invalid cache directory value={}", value);
            return null;
        }
    }
}
