package com.aicmd.cache.decision;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.decision")
public class DecisionProperties {
    private double confidenceThreshold = 0.8;
    private double autoCopyThreshold = 0.9;

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public double getAutoCopyThreshold() {
        return autoCopyThreshold;
    }

    public void setAutoCopyThreshold(double autoCopyThreshold) {
        this.autoCopyThreshold = autoCopyThreshold;
    }

    public void validate() {
        Checks.requireUnitInterval("aicmd.decision.confidence-threshold", confidenceThreshold);
        Checks.requireUnitInterval("aicmd.decision.auto-copy-threshold", autoCopyThreshold);
        if (autoCopyThreshold < confidenceThreshold) {
            throw new IllegalStateException(
                "aicmd.decision.auto-copy-threshold must be >= confidence-threshold but was "
                    + autoCopyThreshold + " < " + confidenceThreshold
            );
        }
    }
}
