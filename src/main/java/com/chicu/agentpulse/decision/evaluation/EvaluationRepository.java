package com.chicu.agentpulse.decision.evaluation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface EvaluationRepository extends JpaRepository<EvaluationEntity, Long> {

    Optional<EvaluationEntity> findBySubjectId(String subjectId);

    boolean existsBySubjectIdAndState(String subjectId, EvaluationState state);

    @Query("select e.subjectId from EvaluationEntity e where e.state = :state")
    List<String> findSubjectIdsByState(@Param("state") EvaluationState state);

    long countByState(EvaluationState state);
}
