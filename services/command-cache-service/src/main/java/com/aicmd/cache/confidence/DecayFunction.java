package com.aicmd.cache.confidence;

@FunctionalInterface
public interface DecayFunction {
    double factor(double days);

    static DecayFunction none() {
        return days -> 1.0;
    }

    static DecayFunction exponential(double halfLifeDays, double floor) {
        return days -> {
            if (days <= 0.0) {
                return 1.0;
            }
            return Math.max(floor, Math.pow(0.5, days / halfLifeDays));
        };
    }

    static DecayFunction linear(double horizonDays, double floor) {
        return days -> {
            if (days <= 0.0) {
                return 1.0;
            }
            return Math.max(floor, 1.0 - days / horizonDays);
        };
    }

    static DecayFunction of(ConfidenceProperties.Decay decay) {
        return switch (decay.getCurve()) {
            case NONE -> none();
            case LINEAR -> linear(decay.getHorizonDays(), decay.getFloor());
            case EXPONENTIAL -> exponential(decay.getHalfLifeDays(), decay.getFloor());
        };
    }
}
