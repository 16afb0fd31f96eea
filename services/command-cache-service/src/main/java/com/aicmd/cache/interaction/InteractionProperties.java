package com.aicmd.cache.interaction;

import com.aicmd.cache.config.Checks;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.interaction")
public class InteractionProperties {
    private boolean enabled = true;
    private int timeoutSeconds = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public void validate() {
        Checks.requirePositive("aicmd.interaction.timeout-seconds", timeoutSeconds);
    }
}
