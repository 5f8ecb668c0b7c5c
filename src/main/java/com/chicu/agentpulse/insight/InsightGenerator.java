package com.chicu.agentpulse.insight;

import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.strategy.StrategyParameters;

import java.util.List;

/**
 * Кандидаты на публикацию. Качество текста не гарантируется — его фильтрует гейт.
 */
public interface InsightGenerator {

    /**
     * @return пустой список при любом сбое
     */
    List<InsightCandidate> generate(EcosystemSnapshotHolder.Snapshot snapshot, StrategyParameters strategy);
}
