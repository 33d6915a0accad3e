package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.exception.GoalConfigurationException;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.model.GoalSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Nudges owners of goals whose local reminder time has just passed and that
 * are still open for the day.
 */
@Service
public class ReminderService {
    private static final Logger logger = LoggerFactory.getLogger(ReminderService.class);

    private final GoalStore goalStore;
    private final CheckInStore checkInStore;
    private final DeadlineCalculator calculator;
    private final NotificationDispatcher notificationDispatcher;

    @Autowired
    public ReminderService(GoalStore goalStore,
                           CheckInStore checkInStore,
                           DeadlineCalculator calculator,
                           NotificationDispatcher notificationDispatcher) {
        this.goalStore = goalStore;
        this.checkInStore = checkInStore;
        this.calculator = calculator;
        this.notificationDispatcher = notificationDispatcher;
    }

    /**
     * @return number of reminders handed to the dispatcher
     */
    public int sendDueReminders(Instant nowUtc, Duration window) {
        List<Goal> goals = goalStore.listActiveGoalsWithReminders(nowUtc, window);
        int sent = 0;
        for (Goal goal : goals) {
            try {
                List<LocalDate> dates = calculator.reminderDates(goal, GoalSchedule.of(goal), nowUtc, window);
                for (LocalDate date : dates) {
                    if (checkInStore.findByGoalAndDate(goal.getId(), date).isPresent()) {
                        continue;
                    }
                    notificationDispatcher.notifyReminder(goal.getUserId(), goal.getId(), goal.getTitle());
                    sent++;
                }
            } catch (GoalConfigurationException e) {
                logger.error("No reminder for goal {}: {}", goal.getId(), e.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Reminder for goal {} failed: {}", goal.getId(), e.getMessage());
            }
        }
        if (sent > 0) {
            logger.info("Queued {} reminders at {}", sent, nowUtc);
        }
        return sent;
    }
}
