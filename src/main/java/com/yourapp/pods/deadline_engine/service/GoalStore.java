package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.repository.GoalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Read side of goals for the background jobs.
 */
@Service
public class GoalStore {
    private static final Logger logger = LoggerFactory.getLogger(GoalStore.class);

    // Largest distance between any zone's local date and the UTC date
    private static final Duration MAX_ZONE_OFFSET = Duration.ofHours(14);

    private final GoalRepository goalRepository;

    @Autowired
    public GoalStore(GoalRepository goalRepository) {
        this.goalRepository = goalRepository;
    }

    /**
     * Non-archived goals whose start/end dates can overlap a deadline inside
     * {@code (nowUtc - window, nowUtc]} in some time zone. The result is a
     * superset; callers apply the per-goal zone check.
     */
    @Transactional(readOnly = true)
    public List<Goal> listActiveGoalsDueAround(Instant nowUtc, Duration window) {
        LocalDate earliest = earliestLocalDate(nowUtc, window);
        LocalDate latest = latestLocalDate(nowUtc);
        List<Goal> goals = goalRepository.findActiveBetween(earliest, latest);
        logger.debug("Loaded {} active goals for local dates {}..{}", goals.size(), earliest, latest);
        return goals;
    }

    @Transactional(readOnly = true)
    public List<Goal> listActiveGoalsWithReminders(Instant nowUtc, Duration window) {
        return goalRepository.findActiveWithReminderBetween(earliestLocalDate(nowUtc, window), latestLocalDate(nowUtc));
    }

    private static LocalDate earliestLocalDate(Instant nowUtc, Duration window) {
        return nowUtc.minus(window).minus(MAX_ZONE_OFFSET).atOffset(ZoneOffset.UTC).toLocalDate();
    }

    private static LocalDate latestLocalDate(Instant nowUtc) {
        return nowUtc.plus(MAX_ZONE_OFFSET).atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
