package com.aicmd.cache.store;

import java.nio.file.Path;
import java.util.Optional;

public record StoreLocation(Path databasePath, Source source) {

    public enum Source {
        CONFIGURED,
        USER_HOME,
        TEMP,
        UNAVAILABLE
    }

    public static StoreLocation unavailable() {
        return new StoreLocation(null, Source.UNAVAILABLE);
    }

    public boolean isAvailable() {
        return databasePath != null && source != Source.UNAVAILABLE;
    }

    public Optional<Path> path() {
        return Optional.ofNullable(databasePath);
    }
}
