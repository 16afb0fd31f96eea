package com.aicmd.cache.cache;

import com.aicmd.cache.matching.MatchingProperties;
import com.aicmd.cache.matching.NormalizedQuery;
import com.aicmd.cache.matching.QueryMatcher;
import com.aicmd.cache.repository.CacheEntry;
import com.aicmd.cache.repository.CacheEntryRepository;
import com.aicmd.cache.store.CommandStore;
import com.aicmd.cache.store.SchemaException;
import com.aicmd.cache.store.StoreCallback;
import com.aicmd.cache.store.StoreUnavailableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CommandCacheManager {
    private static final Logger log = LoggerFactory.getLogger(CommandCacheManager.class);

    private final CommandStore store;
    private final CacheEntryRepository entries;
    private final QueryMatcher matcher;
    private final MatchingProperties matchingProperties;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public CommandCacheManager(
        CommandStore store,
        CacheEntryRepository entries,
        QueryMatcher matcher,
        MatchingProperties matchingProperties,
        CacheProperties cacheProperties,
        Clock clock
    ) {
        matchingProperties.validate();
        cacheProperties.validate();
        this.store = store;
        this.entries = entries;
        this.matcher = matcher;
        this.matchingProperties = matchingProperties;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    public String hash(String query) {
        return matcher.hash(query);
    }

    /**
     * Stores {@code command} as the answer to {@code query}. An existing entry with the same
     * normalized hash is merged: the same command only refreshes usage and platform, a
     * different command replaces the old one and starts a fresh feedback history.
     * Null platform fields are filled in from the running system.
     */
    public CacheEntry save(String query, String command, String osType, String shellType) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        PlatformInfo platform = osType == null || shellType == null ? PlatformInfo.detect() : null;
        String os = osType != null ? osType : platform.osType();
        String shell = shellType != null ? shellType : platform.shellType();
        String queryHash = matcher.hash(query);
        String trimmed = command.trim();
        Instant now = clock.instant();

        return call("save", true, jdbc -> {
            Optional<CacheEntry> existing = entries.findByHash(jdbc, queryHash);
            if (existing.isEmpty()) {
                entries.insert(jdbc, query, queryHash, trimmed, os, shell, now);
                log.debug("cache entry created hash={}", queryHash);
            } else if (existing.get().getCommand().equals(trimmed)) {
                entries.refresh(jdbc, queryHash, query, os, shell, now);
            } else {
                entries.replaceCommand(jdbc, queryHash, query, trimmed, os, shell, now);
                log.info("cache entry command replaced hash={}", queryHash);
            }
            return entries.findByHash(jdbc, queryHash)
                .orElseThrow(() -> new CacheUnavailableException("entry vanished after save hash=" + queryHash));
        });
    }

    public Optional<CacheEntry> findExact(String query) {
        String queryHash = matcher.hash(query);
        return call("findExact", false, jdbc -> entries.findByHash(jdbc, queryHash));
    }

    public Optional<SimilarMatch> findSimilar(String query) {
        return findSimilar(query, cacheProperties.effectiveCandidateLimit());
    }

    public Optional<SimilarMatch> findSimilar(String query, int limit) {
        return findSimilar(query, limit, matchingProperties.getSimilarityThreshold());
    }

    /**
     * Scans up to {@code limit} most-recently-used entries and returns the most similar one
     * at or above {@code threshold}. Ties go to the higher stored confidence, then to the more
     * recently used entry.
     */
    public Optional<SimilarMatch> findSimilar(String query, int limit, double threshold) {
        int bounded = Math.min(limit, cacheProperties.getCacheSizeLimit());
        if (bounded <= 0) {
            return Optional.empty();
        }
        NormalizedQuery normalized = matcher.normalize(query);
        List<CacheEntry> candidates = call("findSimilar", false, jdbc -> entries.listMostRecent(jdbc, bounded));

        SimilarMatch best = null;
        for (CacheEntry candidate : candidates) {
            double similarity = matcher.similarity(normalized, matcher.normalize(candidate.getQueryText()));
            if (similarity < threshold) {
                continue;
            }
            SimilarMatch match = new SimilarMatch(candidate, similarity);
            if (best == null || isBetter(match, best)) {
                best = match;
            }
        }
        if (best != null) {
            log.debug("similar match hash={} similarity={}", best.entry().getQueryHash(), best.similarity());
        }
        return Optional.ofNullable(best);
    }

    public int cleanup() {
        return cleanup(cacheProperties.getMaxCacheAgeDays(), cacheProperties.getCacheSizeLimit());
    }

    public int cleanup(int maxAgeDays, int sizeLimit) {
        if (maxAgeDays < 0 || sizeLimit < 0) {
            throw new IllegalArgumentException("maxAgeDays and sizeLimit must be >= 0");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        int removed = call("cleanup", true, jdbc -> {
            int expired = entries.deleteLastUsedBefore(jdbc, cutoff);
            long remaining = entries.count(jdbc);
            int evicted = remaining > sizeLimit ? entries.deleteLeastRecentlyUsed(jdbc, remaining - sizeLimit) : 0;
            return expired + evicted;
        });
        if (removed > 0) {
            log.info("cache cleanup removed={} max_age_days={} size_limit={}", removed, maxAgeDays, sizeLimit);
        }
        return removed;
    }

    public boolean touch(String queryHash) {
        Instant now = clock.instant();
        return call("touch", true, jdbc -> entries.touch(jdbc, queryHash, now)) > 0;
    }

    public boolean delete(String queryHash) {
        return call("delete", true, jdbc -> entries.deleteByHash(jdbc, queryHash)) > 0;
    }

    public long count() {
        return call("count", false, entries::count);
    }

    public int clear() {
        int removed = call("clear", true, entries::deleteAll);
        log.info("cache cleared removed={}", removed);
        return removed;
    }

    private static boolean isBetter(SimilarMatch candidate, SimilarMatch current) {
        int bySimilarity = Double.compare(candidate.similarity(), current.similarity());
        if (bySimilarity != 0) {
            return bySimilarity > 0;
        }
        int byConfidence = Double.compare(
            candidate.entry().getConfidenceScore(),
            current.entry().getConfidenceScore()
        );
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        return candidate.entry().getLastUsedAt().isAfter(current.entry().getLastUsedAt());
    }

    private <T> T call(String operation, boolean transactional, StoreCallback<T> callback) {
        try {
            if (transactional) {
                return store.inTransaction(operation, callback);
            }
            return store.withConnection(operation, callback);
        } catch (StoreUnavailableException | SchemaException ex) {
            throw new CacheUnavailableException("cache " + operation + " failed: " + ex.getMessage(), ex);
        }
    }
}
