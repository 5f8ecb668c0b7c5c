package com.chicu.agentpulse.engine;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Автостарт оркестратора после подъёма контекста.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentLifecycle {

    private final AgentOrchestrator orchestrator;
    private final SchedulerProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.isAutostart()) {
            log.info("⏸ Autostart disabled (agentpulse.scheduler.autostart=false)");
            return;
        }
        orchestrator.start();
    }

    @PreDestroy
    public void onShutdown() {
        orchestrator.stop();
    }
}
