package com.aicmd.cache.safety;

public enum Severity {
    SAFE,
    WARNING,
    DANGEROUS,
    CRITICAL
}
