package com.chicu.agentpulse.ecosystem;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "agentpulse.ecosystem")
public class EcosystemProperties {

    private String baseUrl = "https://agents.colosseum.com/api";

    /**
     * Bearer токен агента.
     */
    private String apiKey = "";

    private String agentId = "";
    private String agentName = "agentpulse";

    /**
     * Свой проект: за него не голосуем.
     */
    private Long ownProjectId = 244L;

    private int pageSize = 100;
    private int maxPages = 5;

    private int forumFetchLimit = 50;

    private long connectTimeoutMs = 3000;
    private long readTimeoutMs = 10000;
}
