package com.aicmd.cache.decision;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DecisionProperties.class)
public class DecisionConfig {
}
