package com.chicu.agentpulse.web.controller.api;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ledger.Proof;
import com.chicu.agentpulse.ledger.ProofService;
import com.chicu.agentpulse.ledger.ProofStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/proofs")
public class ProofApiController {

    private static final int MAX_LIMIT = 1000;

    private final ProofService proofs;

    @GetMapping
    public List<Proof> list(@RequestParam(defaultValue = "50") int limit,
                            @RequestParam(required = false) String type) {
        ActionType t = null;
        if (type != null && !type.isBlank()) {
            t = ActionType.parseOrNull(type);
            if (t == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unknown action type: " + type);
            }
        }
        return proofs.reconstruct(Math.max(1, Math.min(limit, MAX_LIMIT)), t);
    }

    @GetMapping("/stats")
    public ProofStats stats() {
        return proofs.stats();
    }

    @GetMapping("/{actionId}")
    public Proof proof(@PathVariable String actionId) {
        return proofs.proofFor(actionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no action " + actionId));
    }
}
