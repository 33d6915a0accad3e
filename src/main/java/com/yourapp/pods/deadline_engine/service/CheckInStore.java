package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.repository.CheckInRepository;
import com.yourapp.pods.deadline_engine.repository.GoalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Write access to the check-in ledger and to streak counters.
 * <p>
 * The ledger is append-only: rows are inserted when absent and never
 * overwritten. The {@code (goal_id, check_in_date)} unique constraint decides
 * every race; when a concurrent writer commits between the existence check
 * and the insert, the flush fails with a
 * {@link org.springframework.dao.DataIntegrityViolationException} that rolls
 * back the surrounding transaction and must be read by the caller as
 * {@link InsertResult#ALREADY_EXISTS}.
 */
@Service
public class CheckInStore {
    private static final Logger logger = LoggerFactory.getLogger(CheckInStore.class);

    private final CheckInRepository checkInRepository;
    private final GoalRepository goalRepository;

    @Autowired
    public CheckInStore(CheckInRepository checkInRepository, GoalRepository goalRepository) {
        this.checkInRepository = checkInRepository;
        this.goalRepository = goalRepository;
    }

    @Transactional(readOnly = true)
    public Optional<CheckIn> findByGoalAndDate(Long goalId, LocalDate date) {
        return checkInRepository.findByGoalIdAndDate(goalId, date);
    }

    @Transactional
    public InsertResult insertIfAbsent(CheckIn checkIn) {
        Long goalId = checkIn.getGoal().getId();
        if (checkInRepository.existsByGoalIdAndDate(goalId, checkIn.getDate())) {
            return InsertResult.ALREADY_EXISTS;
        }
        checkInRepository.saveAndFlush(checkIn);
        logger.debug("Inserted {} check-in for goal {} on {}", checkIn.getStatus(), goalId, checkIn.getDate());
        return InsertResult.CREATED;
    }

    @Transactional
    public InsertResult insertIfAbsent(Goal goal, LocalDate date, CheckInStatus status, Instant now) {
        return insertIfAbsent(new CheckIn(goal, date, status, now));
    }

    /**
     * Sets the current streak to zero. Only meant to follow a MISSED insert
     * that returned {@link InsertResult#CREATED}.
     */
    @Transactional
    public void resetStreak(Long goalId, Instant now) {
        int updated = goalRepository.resetCurrentStreak(goalId, now);
        if (updated == 0) {
            logger.warn("Streak reset matched no goal row for goal {}", goalId);
        }
    }

    /**
     * Writes the MISSED row and, only when this call created it, resets the
     * streak. Both happen in one transaction.
     */
    @Transactional
    public InsertResult recordMissed(Goal goal, LocalDate date, Instant now) {
        InsertResult result = insertIfAbsent(goal, date, CheckInStatus.MISSED, now);
        if (result == InsertResult.CREATED) {
            resetStreak(goal.getId(), now);
        }
        return result;
    }
}
