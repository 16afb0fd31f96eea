package com.aicmd.cache.interaction;

public enum ConfirmationResult {
    CONFIRMED,
    REJECTED,
    TIMED_OUT
}
