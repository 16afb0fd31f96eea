package com.aicmd.cache.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DegradationProperties.class)
public class ResilienceConfig {
}
