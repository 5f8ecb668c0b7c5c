package com.chicu.agentpulse.web.controller.api;

import com.chicu.agentpulse.engine.AgentOrchestrator;
import com.chicu.agentpulse.engine.EngineStatus;
import com.chicu.agentpulse.engine.LoopRunResult;
import com.chicu.agentpulse.strategy.Strategy;
import com.chicu.agentpulse.strategy.StrategyHolder;
import com.chicu.agentpulse.web.dto.TriggerResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/agent")
public class AgentApiController {

    private final AgentOrchestrator orchestrator;
    private final StrategyHolder strategy;

    @GetMapping("/status")
    public EngineStatus status() {
        return orchestrator.status();
    }

    @PostMapping("/loops/{name}/trigger")
    public TriggerResponse trigger(@PathVariable String name) {
        LoopRunResult r = orchestrator.trigger(name);
        if (r == LoopRunResult.UNKNOWN_LOOP) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "unknown loop '" + name + "', known: " + orchestrator.loopNames());
        }
        return new TriggerResponse(name, r);
    }

    @GetMapping("/strategy")
    public Strategy strategy() {
        return strategy.current();
    }
}
