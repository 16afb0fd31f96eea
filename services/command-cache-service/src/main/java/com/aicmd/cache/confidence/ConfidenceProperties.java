package com.aicmd.cache.confidence;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.confidence")
public class ConfidenceProperties {
    private double positiveWeight = 0.2;
    private double negativeWeight = 0.6;
    private double priorWeight = 0.5;
    private Decay decay = new Decay();

    public double getPositiveWeight() {
        return positiveWeight;
    }

    public void setPositiveWeight(double positiveWeight) {
        this.positiveWeight = positiveWeight;
    }

    public double getNegativeWeight() {
        return negativeWeight;
    }

    public void setNegativeWeight(double negativeWeight) {
        this.negativeWeight = negativeWeight;
    }

    public double getPriorWeight() {
        return priorWeight;
    }

    public void setPriorWeight(double priorWeight) {
        this.priorWeight = priorWeight;
    }

    public Decay getDecay() {
        return decay;
    }

    public void setDecay(Decay decay) {
        this.decay = decay;
    }

    public void validate() {
        Checks.requirePositive("aicmd.confidence.positive-weight", positiveWeight);
        Checks.requirePositive("aicmd.confidence.negative-weight", negativeWeight);
        Checks.requirePositive("aicmd.confidence.prior-weight", priorWeight);
        if (negativeWeight <= positiveWeight) {
            throw new IllegalStateException("aicmd.confidence.negative-weight must be greater than positive-weight");
        }
        if (decay == null || decay.getCurve() == null) {
            throw new IllegalStateException("aicmd.confidence.decay.curve is required");
        }
        Checks.requirePositive("aicmd.confidence.decay.half-life-days", decay.getHalfLifeDays());
        Checks.requirePositive("aicmd.confidence.decay.horizon-days", decay.getHorizonDays());
        Checks.requireUnitInterval("aicmd.confidence.decay.floor", decay.getFloor());
    }

    public static class Decay {
        private DecayCurve curve = DecayCurve.EXPONENTIAL;
        private double halfLifeDays = 30.0;
        private double horizonDays = 90.0;
        private double floor = 0.1;

        public DecayCurve getCurve() {
            return curve;
        }

        public void setCurve(DecayCurve curve) {
            this.curve = curve;
        }

        public double getHalfLifeDays() {
            return halfLifeDays;
        }

        public void setHalfLifeDays(double halfLifeDays) {
            this.halfLifeDays = halfLifeDays;
        }

        public double getHorizonDays() {
            return horizonDays;
        }

        public void setHorizonDays(double horizonDays) {
            this.horizonDays = horizonDays;
        }

        public double getFloor() {
            return floor;
        }

        public void setFloor(double floor) {
            this.floor = floor;
        }
    }
}
