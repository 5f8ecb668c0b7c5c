package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.time.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentConfig {

    /**
     * Пауза между шагами циклов (rate limit внешних API).
     */
    @Bean
    public Sleeper loopSleeper() {
        return Sleeper.threadSleep();
    }
}
