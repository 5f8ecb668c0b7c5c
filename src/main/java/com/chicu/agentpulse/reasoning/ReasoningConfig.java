package com.chicu.agentpulse.reasoning;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReasoningProperties.class)
public class ReasoningConfig {
}
