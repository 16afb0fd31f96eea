package com.aicmd.cache.cache;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.cache")
public class CacheProperties {
    private int maxCacheAgeDays = 30;
    private int cacheSizeLimit = 1000;
    private int similarCandidateLimit = 0;
    private boolean cleanupOnStartup = false;

    public int getMaxCacheAgeDays() {
        return maxCacheAgeDays;
    }

    public void setMaxCacheAgeDays(int maxCacheAgeDays) {
        this.maxCacheAgeDays = maxCacheAgeDays;
    }

    public int getCacheSizeLimit() {
        return cacheSizeLimit;
    }

    public void setCacheSizeLimit(int cacheSizeLimit) {
        this.cacheSizeLimit = cacheSizeLimit;
    }

    public int getSimilarCandidateLimit() {
        return similarCandidateLimit;
    }

    public void setSimilarCandidateLimit(int similarCandidateLimit) {
        this.similarCandidateLimit = similarCandidateLimit;
    }

    public int effectiveCandidateLimit() {
        if (similarCandidateLimit <= 0) {
            return cacheSizeLimit;
        }
        return Math.min(similarCandidateLimit, cacheSizeLimit);
    }

    public boolean isCleanupOnStartup() {
        return cleanupOnStartup;
    }

    public void setCleanupOnStartup(boolean cleanupOnStartup) {
        this.cleanupOnStartup = cleanupOnStartup;
    }

    public void validate() {
        Checks.requirePositive("aicmd.cache.max-cache-age-days", maxCacheAgeDays);
        Checks.requirePositive("aicmd.cache.cache-size-limit", cacheSizeLimit);
        Checks.requireNonNegative("aicmd.cache.similar-candidate-limit", similarCandidateLimit);
    }
}
