package com.aicmd.cache.safety;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "aicmd.safety")
public class SafetyProperties {
    private List<String> extraPatterns = new ArrayList<>();

    public List<String> getExtraPatterns() {
        return extraPatterns;
    }

    public void setExtraPatterns(List<String> extraPatterns) {
        this.extraPatterns = extraPatterns;
    }
}
