package com.aicmd.cache.interaction;

public enum CommandSource {
    EXACT_CACHE,
    SIMILAR_CACHE,
    TRANSLATION
}
