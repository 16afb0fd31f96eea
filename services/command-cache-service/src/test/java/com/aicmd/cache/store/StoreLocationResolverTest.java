package com.aicmd.cache.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreLocationResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void configuredDirectoryWinsWhenWritable() {
        StoreProperties properties = new StoreProperties();
        properties.setDirectory(tempDir.resolve("configured").toString());

        StoreLocation location = new StoreLocationResolver(properties, tempDir.resolve("home").toString(), null)
            .resolveLocation();

        assertThat(location.source()).isEqualTo(StoreLocation.Source.CONFIGURED);
        assertThat(location.databasePath()).isEqualTo(tempDir.resolve("configured").resolve("cache.db"));
        assertThat(Files.isDirectory(tempDir.resolve("configured"))).isTrue();
    }

    @Test
    void fallsBackToUserHomeWhenConfiguredDirectoryIsUnusable() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        StoreProperties properties = new StoreProperties();
        properties.setDirectory(blocker.resolve("cache").toString());

        StoreLocation location = new StoreLocationResolver(properties, tempDir.resolve("home").toString(), null)
            .resolveLocation();

        assertThat(location.source()).isEqualTo(StoreLocation.Source.USER_HOME);
        assertThat(location.databasePath())
            .isEqualTo(tempDir.resolve("home").resolve(StoreLocationResolver.USER_DIR_NAME).resolve("cache.db"));
    }

    @Test
    void fallsBackToTempDirectoryWhenHomeIsUnusable() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("home-file"));
        StoreProperties properties = new StoreProperties();

        StoreLocation location = new StoreLocationResolver(
            properties,
            blocker.toString(),
            tempDir.resolve("tmp").toString()
        ).resolveLocation();

        assertThat(location.source()).isEqualTo(StoreLocation.Source.TEMP);
        assertThat(location.databasePath())
            .isEqualTo(tempDir.resolve("tmp").resolve(StoreLocationResolver.TEMP_DIR_NAME).resolve("cache.db"));
    }

    @Test
    void reportsUnavailableWhenNoCandidateIsWritable() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        StoreProperties properties = new StoreProperties();
        properties.setDirectory(blocker.resolve("a").toString());

        StoreLocation location = new StoreLocationResolver(
            properties,
            blocker.toString(),
            blocker.toString()
        ).resolveLocation();

        assertThat(location.isAvailable()).isFalse();
        assertThat(location.path()).isEmpty();
    }

    @Test
    void disabledStoreIsUnavailableWithoutTouchingDisk() {
        StoreProperties properties = new StoreProperties();
        properties.setEnabled(false);
        properties.setDirectory(tempDir.resolve("never").toString());

        StoreLocation location = new StoreLocationResolver(properties, tempDir.toString(), tempDir.toString())
            .resolveLocation();

        assertThat(location.isAvailable()).isFalse();
        assertThat(Files.exists(tempDir.resolve("never"))).isFalse();
    }

    @Test
    void expandsTildeAgainstUserHome() {
        StoreProperties properties = new StoreProperties();
        properties.setDirectory("~/custom-cache");
        properties.setDatabaseFile("commands.db");

        StoreLocation location = new StoreLocationResolver(properties, tempDir.toString(), null).resolveLocation();

        assertThat(location.source()).isEqualTo(StoreLocation.Source.CONFIGURED);
        assertThat(location.databasePath()).isEqualTo(tempDir.resolve("custom-cache").resolve("commands.db"));
    }
}
