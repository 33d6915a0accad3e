package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.dto.CheckInResponse;
import com.yourapp.pods.deadline_engine.dto.TodayStatusResponse;
import com.yourapp.pods.deadline_engine.exception.ConflictException;
import com.yourapp.pods.deadline_engine.exception.ForbiddenException;
import com.yourapp.pods.deadline_engine.exception.NotFoundException;
import com.yourapp.pods.deadline_engine.exception.ValidationException;
import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.model.GoalSchedule;
import com.yourapp.pods.deadline_engine.repository.CheckInRepository;
import com.yourapp.pods.deadline_engine.repository.GoalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * User-facing check-ins. A user may only settle the current local day of a
 * goal; past days are settled by the deadline evaluator.
 */
@Service
public class CheckInService {
    private static final Logger logger = LoggerFactory.getLogger(CheckInService.class);

    static final Duration MAX_CLIENT_TIMESTAMP_AGE = Duration.ofHours(6);
    static final int MAX_LIMIT = 100;
    static final int MAX_OFFSET = 10_000;

    private final GoalRepository goalRepository;
    private final CheckInRepository checkInRepository;
    private final CheckInStore checkInStore;
    private final DeadlineCalculator calculator;
    private final StreakCalculator streakCalculator;

    @Autowired
    public CheckInService(GoalRepository goalRepository,
                          CheckInRepository checkInRepository,
                          CheckInStore checkInStore,
                          DeadlineCalculator calculator,
                          StreakCalculator streakCalculator) {
        this.goalRepository = goalRepository;
        this.checkInRepository = checkInRepository;
        this.checkInStore = checkInStore;
        this.calculator = calculator;
        this.streakCalculator = streakCalculator;
    }

    /**
     * Records today's check-in for a goal and recomputes its streak.
     * <p>
     * A concurrent insert for the same day can still surface as a
     * {@link org.springframework.dao.DataIntegrityViolationException} after
     * this transaction rolls back; the web layer answers it with 409 like the
     * {@link ConflictException} thrown here.
     */
    @Transactional
    public CheckInResponse checkIn(Long goalId, Long userId, CheckInStatus status, String comment,
                                   String proofUrl, Instant clientTimestamp, Instant nowUtc) {
        CheckInStatus effectiveStatus = status != null ? status : CheckInStatus.COMPLETED;
        if (effectiveStatus == CheckInStatus.MISSED) {
            throw new ValidationException("Status must be COMPLETED or SKIPPED");
        }

        Goal goal = goalRepository.findById(goalId)
            .orElseThrow(() -> new NotFoundException("Goal not found: " + goalId));
        if (!goal.getUserId().equals(userId)) {
            throw new ForbiddenException("Not your goal");
        }
        if (goal.isArchived()) {
            throw new ValidationException("Goal is archived");
        }
        if (effectiveStatus == CheckInStatus.COMPLETED && goal.isRequiresProof()
                && (proofUrl == null || proofUrl.isBlank())) {
            throw new ValidationException("This goal requires a proof URL");
        }
        if (clientTimestamp != null && clientTimestamp.isBefore(nowUtc.minus(MAX_CLIENT_TIMESTAMP_AGE))) {
            throw new ValidationException("Check-in timestamp is too old");
        }

        LocalDate today = calculator.localDate(goal, nowUtc);
        if (!goal.isActiveOn(today)) {
            throw new ValidationException("Goal is not active on " + today);
        }

        CheckIn checkIn = new CheckIn(goal, today, effectiveStatus, nowUtc);
        checkIn.setComment(comment);
        checkIn.setProofUrl(proofUrl);
        checkIn.setClientTimestamp(clientTimestamp);
        if (checkInStore.insertIfAbsent(checkIn) == InsertResult.ALREADY_EXISTS) {
            throw new ConflictException("ALREADY_CHECKED_IN", "Already checked in for " + today);
        }

        List<CheckIn> history = checkInRepository.findHistory(goal.getId(), today);
        int streak = streakCalculator.currentStreak(goal, GoalSchedule.of(goal), today, history);
        goal.setCurrentStreak(streak);
        goalRepository.save(goal);

        logger.info("User {} checked in {} for goal {} on {}, streak {}", userId, effectiveStatus, goalId, today, streak);
        return CheckInResponse.of(checkIn, goal.getId(), goal.getCurrentStreak(), goal.getLongestStreak());
    }

    @Transactional(readOnly = true)
    public List<CheckInResponse> listCheckIns(Long goalId, Long userId, int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new ValidationException("offset must be between 0 and " + MAX_OFFSET);
        }
        Goal goal = ownedGoal(goalId, userId);

        // rows before the offset are fetched and dropped
        List<CheckIn> rows = checkInRepository.findByGoalIdOrderByDateDesc(goal.getId(), PageRequest.of(0, offset + limit));
        return rows.stream()
            .skip(offset)
            .map(c -> CheckInResponse.of(c, goal.getId()))
            .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TodayStatusResponse todayStatus(Long goalId, Long userId, Instant nowUtc) {
        Goal goal = ownedGoal(goalId, userId);
        LocalDate today = calculator.localDate(goal, nowUtc);
        boolean scheduled = goal.isActiveOn(today) && GoalSchedule.of(goal).isScheduledOn(today.getDayOfWeek());
        Optional<CheckIn> checkIn = checkInRepository.findByGoalIdAndDate(goal.getId(), today);
        return new TodayStatusResponse(
            goal.getId(),
            today,
            scheduled,
            checkIn.isPresent(),
            checkIn.map(CheckIn::getStatus).orElse(null),
            calculator.deadlineInstant(goal, today),
            goal.getCurrentStreak(),
            goal.getLongestStreak());
    }

    private Goal ownedGoal(Long goalId, Long userId) {
        Goal goal = goalRepository.findById(goalId)
            .orElseThrow(() -> new NotFoundException("Goal not found: " + goalId));
        if (!goal.getUserId().equals(userId)) {
            throw new ForbiddenException("Not your goal");
        }
        return goal;
    }
}
