package com.chicu.agentpulse.common.retry;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "agentpulse.retry")
public class RetryProperties {

    /**
     * Сколько раз повторяем после первой попытки.
     */
    private int maxRetries = 3;

    /**
     * Фиксированная пауза между попытками.
     */
    private Duration backoff = Duration.ofSeconds(30);
}
