package com.aicmd.cache.safety;

import java.util.List;

public record SafetyVerdict(Severity severity, List<String> warnings) {
    private static final SafetyVerdict SAFE = new SafetyVerdict(Severity.SAFE, List.of());

    public SafetyVerdict {
        warnings = List.copyOf(warnings);
    }

    public static SafetyVerdict safe() {
        return SAFE;
    }

    public boolean dangerous() {
        return severity != Severity.SAFE;
    }
}
