package com.aicmd.cache.confidence;

public record ConfidenceStats(
    long veryHigh,
    long high,
    long medium,
    long low,
    long totalConfirmations,
    long totalRejections,
    double averageConfidence
) {
    public long total() {
        return veryHigh + high + medium + low;
    }
}
