package com.aicmd.cache.repository;

import java.util.Locale;

public enum FeedbackAction {
    CONFIRM,
    REJECT;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FeedbackAction fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("feedback action is blank");
        }
        return FeedbackAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static FeedbackAction of(boolean confirmed) {
        return confirmed ? CONFIRM : REJECT;
    }
}
