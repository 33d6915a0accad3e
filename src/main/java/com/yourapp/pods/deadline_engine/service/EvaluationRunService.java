package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.model.EvaluationOutcome;
import com.yourapp.pods.deadline_engine.model.EvaluationRun;
import com.yourapp.pods.deadline_engine.repository.EvaluationRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Keeps the per (goal, date) evaluation bookkeeping. Every write here is best
 * effort: a lost row only costs one redundant check-in lookup on a later tick.
 */
@Service
public class EvaluationRunService {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationRunService.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final EvaluationRunRepository runRepository;

    @Autowired
    public EvaluationRunService(EvaluationRunRepository runRepository) {
        this.runRepository = runRepository;
    }

    // uses the repository's own read-only transaction
    public boolean isResolved(Long goalId, LocalDate date) {
        try {
            return runRepository.findByGoalIdAndEvaluationDate(goalId, date)
                .map(EvaluationRun::isTerminal)
                .orElse(false);
        } catch (DataAccessException e) {
            logger.warn("Could not read evaluation run for goal {} on {}, evaluating anyway", goalId, date, e);
            return false;
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(Long goalId, LocalDate date, EvaluationOutcome outcome, String error, Instant now) {
        EvaluationRun run = runRepository.findByGoalIdAndEvaluationDate(goalId, date)
            .orElseGet(() -> new EvaluationRun(goalId, date));
        if (run.isTerminal()) {
            // settled rows are never downgraded by a late or overlapping tick
            return;
        }
        run.setOutcome(outcome);
        run.setAttempts(run.getAttempts() + 1);
        run.setLastError(truncate(error));
        run.setEvaluatedAt(now);
        runRepository.save(run);
    }

    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        return runRepository.deleteByEvaluatedAtBefore(cutoff);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
