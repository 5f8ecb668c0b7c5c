package com.chicu.agentpulse.reasoning;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "agentpulse.reasoning")
public class ReasoningProperties {

    /**
     * Anthropic-совместимый endpoint, без /messages.
     */
    private String baseUrl = "https://api.anthropic.com/v1";

    private String apiKey = "";

    private String model = "claude-sonnet-4-20250514";

    private int maxTokens = 1024;

    private long connectTimeoutMs = 3000;
    private long readTimeoutMs = 60000;
}
