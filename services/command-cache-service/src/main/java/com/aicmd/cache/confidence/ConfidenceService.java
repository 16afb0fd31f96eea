package com.aicmd.cache.confidence;

import com.aicmd.cache.repository.CacheEntry;
import com.aicmd.cache.repository.CacheEntryRepository;
import com.aicmd.cache.repository.FeedbackAction;
import com.aicmd.cache.repository.FeedbackEventRepository;
import com.aicmd.cache.store.CommandStore;
import com.aicmd.cache.store.StoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConfidenceService {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceService.class);

    static final double VERY_HIGH = 0.9;
    static final double HIGH = 0.8;
    static final double MEDIUM = 0.5;

    private final CommandStore store;
    private final CacheEntryRepository entries;
    private final FeedbackEventRepository feedbackEvents;
    private final ConfidenceCalculator calculator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ConfidenceService(
        CommandStore store,
        CacheEntryRepository entries,
        FeedbackEventRepository feedbackEvents,
        ConfidenceCalculator calculator,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.store = store;
        this.entries = entries;
        this.feedbackEvents = feedbackEvents;
        this.calculator = calculator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Applies one confirm or reject to the entry: counter, recomputed score and the audit
     * event commit together. A confirmation also marks the entry as used now.
     *
     * @return the updated entry, or empty when no entry has this hash
     */
    public Optional<CacheEntry> updateFeedback(String queryHash, boolean confirmed) {
        FeedbackAction action = FeedbackAction.of(confirmed);
        Instant now = clock.instant();
        Optional<CacheEntry> updated = store.inTransaction("updateFeedback", jdbc -> {
            Optional<CacheEntry> current = entries.findByHash(jdbc, queryHash);
            if (current.isEmpty()) {
                return Optional.<CacheEntry>empty();
            }
            CacheEntry entry = current.get();
            int confirmations = entry.getConfirmationCount() + (confirmed ? 1 : 0);
            int rejections = entry.getRejectionCount() + (confirmed ? 0 : 1);
            double score = calculator.calculate(confirmations, rejections);
            entries.updateFeedback(jdbc, queryHash, confirmations, rejections, score, confirmed ? now : null);
            feedbackEvents.append(jdbc, queryHash, entry.getCommand(), action, now);
            return entries.findByHash(jdbc, queryHash);
        });
        if (updated.isEmpty()) {
            log.debug("feedback ignored, no entry hash={} action={}", queryHash, action.dbValue());
            return updated;
        }
        meterRegistry.counter("aicmd_feedback_total", "action", action.dbValue()).increment();
        log.debug(
            "feedback recorded hash={} action={} score={}",
            queryHash,
            action.dbValue(),
            updated.get().getConfidenceScore()
        );
        return updated;
    }

    public RecalculationResult recalculateAll() {
        List<String> hashes = store.withConnection("listHashes", entries::listHashes);
        int updated = 0;
        int failed = 0;
        for (String hash : hashes) {
            try {
                boolean changed = store.inTransaction("recalculate", jdbc -> {
                    Optional<CacheEntry> entry = entries.findByHash(jdbc, hash);
                    if (entry.isEmpty()) {
                        return false;
                    }
                    double score = calculator.calculate(
                        entry.get().getConfirmationCount(),
                        entry.get().getRejectionCount()
                    );
                    if (Double.compare(score, entry.get().getConfidenceScore()) == 0) {
                        return false;
                    }
                    entries.updateScore(jdbc, hash, score);
                    return true;
                });
                if (changed) {
                    updated++;
                }
            } catch (StoreUnavailableException ex) {
                failed++;
                log.warn("confidence recalculation failed hash={} error={}", hash, ex.getMessage());
            }
        }
        log.info("confidence recalculated processed={} updated={} failed={}", hashes.size(), updated, failed);
        return new RecalculationResult(hashes.size(), updated, failed);
    }

    public ConfidenceStats confidenceStats() {
        return store.withConnection("confidenceStats", jdbc -> {
            long veryHigh = entries.countInScoreRange(jdbc, VERY_HIGH, Double.MAX_VALUE);
            long high = entries.countInScoreRange(jdbc, HIGH, VERY_HIGH);
            long medium = entries.countInScoreRange(jdbc, MEDIUM, HIGH);
            long low = entries.countInScoreRange(jdbc, -Double.MAX_VALUE, MEDIUM);
            Map<String, Object> totals = entries.feedbackTotals(jdbc);
            return new ConfidenceStats(
                veryHigh,
                high,
                medium,
                low,
                asLong(totals.get("confirmations")),
                asLong(totals.get("rejections")),
                asDouble(totals.get("avg_confidence"))
            );
        });
    }

    public int cleanupLowConfidence(double threshold, int maxEntries) {
        if (maxEntries <= 0) {
            return 0;
        }
        List<String> hashes = store.withConnection(
            "listLowConfidence",
            jdbc -> entries.listLowConfidenceHashes(jdbc, threshold, maxEntries)
        );
        int removed = 0;
        for (String hash : hashes) {
            try {
                removed += store.inTransaction("deleteLowConfidence", jdbc -> entries.deleteByHash(jdbc, hash));
            } catch (StoreUnavailableException ex) {
                log.warn("low confidence cleanup failed hash={} error={}", hash, ex.getMessage());
            }
        }
        if (removed > 0) {
            log.info("low confidence entries removed count={} threshold={}", removed, threshold);
        }
        return removed;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static double asDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : 0.0;
    }
}
