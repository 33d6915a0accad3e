package com.yourapp.pods.deadline_engine.repository;

import com.yourapp.pods.deadline_engine.model.EvaluationRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

public interface EvaluationRunRepository extends JpaRepository<EvaluationRun, Long> {

    Optional<EvaluationRun> findByGoalIdAndEvaluationDate(Long goalId, LocalDate evaluationDate);

    @Modifying
    @Query("DELETE FROM EvaluationRun r WHERE r.evaluatedAt < :cutoff")
    int deleteByEvaluatedAtBefore(@Param("cutoff") Instant cutoff);
}
