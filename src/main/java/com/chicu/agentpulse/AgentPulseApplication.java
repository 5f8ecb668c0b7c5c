package com.chicu.agentpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication(scanBasePackages = "com.chicu.agentpulse")
public class AgentPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentPulseApplication.class, args);
    }

    /**
     * Все метки времени и дневные лимиты в UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
