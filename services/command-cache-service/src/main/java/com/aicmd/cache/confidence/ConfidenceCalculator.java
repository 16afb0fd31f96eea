package com.aicmd.cache.confidence;

import com.aicmd.cache.repository.CacheEntry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Weighted-counter trust model.
 *
 * <pre>
 * positive = confirmations * positiveWeight
 * negative = rejections * negativeWeight
 * score    = clamp((positive - negative) / (positive + negative + priorWeight), 0, 1)
 * </pre>
 *
 * The effective score multiplies the stored score by a decay factor of the days elapsed
 * since the entry was last used.
 */
@Component
public class ConfidenceCalculator {
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final double positiveWeight;
    private final double negativeWeight;
    private final double priorWeight;
    private final DecayFunction decayFunction;
    private final Clock clock;

    public ConfidenceCalculator(ConfidenceProperties properties, DecayFunction decayFunction, Clock clock) {
        properties.validate();
        this.positiveWeight = properties.getPositiveWeight();
        this.negativeWeight = properties.getNegativeWeight();
        this.priorWeight = properties.getPriorWeight();
        this.decayFunction = decayFunction;
        this.clock = clock;
    }

    public double calculate(int confirmations, int rejections) {
        if (confirmations < 0 || rejections < 0) {
            throw new IllegalArgumentException("feedback counters must be >= 0");
        }
        double positive = confirmations * positiveWeight;
        double negative = rejections * negativeWeight;
        double score = (positive - negative) / (positive + negative + priorWeight);
        return clamp(score);
    }

    public double decayFactor(Instant lastUsedAt) {
        if (lastUsedAt == null) {
            return 1.0;
        }
        long elapsedMillis = Duration.between(lastUsedAt, clock.instant()).toMillis();
        double factor = decayFunction.factor(elapsedMillis / MILLIS_PER_DAY);
        return clamp(Math.min(1.0, factor));
    }

    public double effective(double rawScore, Instant lastUsedAt) {
        return clamp(rawScore * decayFactor(lastUsedAt));
    }

    public double effective(CacheEntry entry) {
        return effective(entry.getConfidenceScore(), entry.getLastUsedAt());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
