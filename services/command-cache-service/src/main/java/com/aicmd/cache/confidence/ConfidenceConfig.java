package com.aicmd.cache.confidence;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ConfidenceProperties.class)
public class ConfidenceConfig {

    @Bean
    public DecayFunction decayFunction(ConfidenceProperties properties) {
        properties.validate();
        return DecayFunction.of(properties.getDecay());
    }
}
