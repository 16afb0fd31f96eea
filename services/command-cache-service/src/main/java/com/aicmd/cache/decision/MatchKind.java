package com.aicmd.cache.decision;

public enum MatchKind {
    NO_MATCH,
    EXACT_MATCH,
    SIMILAR_MATCH
}
