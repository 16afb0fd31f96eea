package com.aicmd.cache.cache;

import com.aicmd.cache.repository.CacheEntry;

public record SimilarMatch(CacheEntry entry, double similarity) {}
