package com.chicu.agentpulse.strategy.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AdaptationRecordRepository extends JpaRepository<AdaptationRecordEntity, Long> {

    Optional<AdaptationRecordEntity> findTopByOrderByToVersionDesc();

    List<AdaptationRecordEntity> findByOrderByToVersionDesc(Pageable page);
}
