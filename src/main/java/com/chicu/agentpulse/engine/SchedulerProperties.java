package com.chicu.agentpulse.engine;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "agentpulse.scheduler")
public class SchedulerProperties {

    /**
     * Стартовать циклы сразу после подъёма контекста.
     */
    private boolean autostart = true;

    private Duration dataRefresh = Duration.ofMinutes(5);
    private Duration insightPosting = Duration.ofHours(1);
    private Duration voting = Duration.ofHours(4);
    private Duration strategyAdaptation = Duration.ofHours(6);
    private Duration snapshot = Duration.ofHours(12);
    private Duration commentReply = Duration.ofMinutes(30);
    private Duration forumEngagement = Duration.ofHours(2);
    private Duration spotlight = Duration.ofHours(24);
    private Duration dailyDigest = Duration.ofHours(24);
}
