package com.chicu.agentpulse.ecosystem;

import com.chicu.agentpulse.common.retry.RetryPolicy;
import com.chicu.agentpulse.common.retry.RetryProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        EcosystemProperties.class,
        RetryProperties.class
})
public class EcosystemConfig {

    /**
     * Ретраится только 429; остальные ошибки сразу наверх.
     */
    @Bean
    public RetryPolicy rateLimitRetryPolicy(RetryProperties props) {
        return RetryPolicy.rateLimited(props);
    }
}
