package com.aicmd.cache.interaction;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(InteractionProperties.class)
public class InteractionConfig {
}
