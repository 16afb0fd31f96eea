package com.aicmd.cache.config;

public final class Checks {
    private Checks() {
    }

    public static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException(name + " must be within [0, 1] but was " + value);
        }
    }

    public static void requirePositive(String name, double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            throw new IllegalStateException(name + " must be > 0 but was " + value);
        }
    }

    public static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalStateException(name + " must be >= 0 but was " + value);
        }
    }
}
