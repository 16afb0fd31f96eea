package com.aicmd.cache.decision;

import java.util.Locale;

public enum DecisionAction {
    AUTO_USE,
    CONFIRM,
    TRANSLATE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
