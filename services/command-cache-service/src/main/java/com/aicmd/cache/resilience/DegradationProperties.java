package com.aicmd.cache.resilience;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.resilience")
public class DegradationProperties {
    private int errorThreshold = 3;

    public int getErrorThreshold() {
        return errorThreshold;
    }

    public void setErrorThreshold(int errorThreshold) {
        this.errorThreshold = errorThreshold;
    }

    public void validate() {
        Checks.requirePositive("aicmd.resilience.error-threshold", errorThreshold);
    }
}
