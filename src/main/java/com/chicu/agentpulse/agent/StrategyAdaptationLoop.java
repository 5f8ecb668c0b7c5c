package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.strategy.AdaptationResult;
import com.chicu.agentpulse.strategy.AdaptationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class StrategyAdaptationLoop implements AgentLoop {

    public static final String NAME = "strategy-adaptation";

    private final AdaptationService adaptation;
    private final SchedulerProperties schedulerProps;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.SELF_IMPROVEMENT;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getStrategyAdaptation();
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void runIteration() {
        AdaptationResult r = adaptation.runCycle();
        log.debug("🧬 Adaptation loop: applied={} v{} -> v{}", r.applied(), r.fromVersion(), r.toVersion());
    }
}
