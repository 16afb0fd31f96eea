package com.aicmd.cache.confidence;

public record RecalculationResult(int processed, int updated, int failed) {}
