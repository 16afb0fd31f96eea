package com.aicmd.cache.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StoreMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(StoreMaintenanceService.class);
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final CommandStore store;
    private final Clock clock;

    public StoreMaintenanceService(CommandStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Path backup() {
        Path databasePath = store.getDatabasePath();
        if (databasePath == null) {
            throw new StoreUnavailableException("cache store location unavailable");
        }
        String suffix = LocalDateTime.now(clock).format(BACKUP_SUFFIX);
        return backup(databasePath.resolveSibling(databasePath.getFileName() + ".backup." + suffix));
    }

    public Path backup(Path target) {
        if (Files.exists(target)) {
            throw new StoreUnavailableException("backup target already exists: " + target);
        }
        store.withConnection("backup", jdbc -> jdbc.update("VACUUM INTO ?", target.toAbsolutePath().toString()));
        log.info("cache store backed up to {}", target);
        return target;
    }

    public StoreStats stats() {
        if (!store.isAvailable()) {
            return StoreStats.unavailable();
        }
        long entries = store.withConnection("stats", jdbc -> count(jdbc.queryForObject("SELECT COUNT(*) FROM command_cache", Long.class)));
        long events = store.withConnection("stats", jdbc -> count(jdbc.queryForObject("SELECT COUNT(*) FROM feedback_event", Long.class)));
        Path path = store.getDatabasePath();
        return new StoreStats(true, path.toString(), entries, events, sizeOf(path));
    }

    private long count(Long value) {
        return value == null ? 0L : value;
    }

    private long sizeOf(Path path) {
        long size = 0L;
        for (Path file : new Path[] {path, path.resolveSibling(path.getFileName() + "-wal")}) {
            try {
                if (Files.exists(file)) {
                    size += Files.size(file);
                }
            } catch (IOException ex) {
                log.debug("could not read size of {}: {}", file, ex.getMessage());
            }
        }
        return size;
    }
}
