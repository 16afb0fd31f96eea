package com.aicmd.cache.confidence;

public enum DecayCurve {
    NONE,
    EXPONENTIAL,
    LINEAR
}
