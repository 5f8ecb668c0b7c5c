package com.chicu.agentpulse.decision;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DecisionProperties.class)
public class DecisionConfig {
}
