package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.exception.GoalConfigurationException;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.model.GoalSchedule;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Zone-aware arithmetic for goal deadlines and reminders.
 * <p>
 * Times of day are always applied to the goal's local calendar through
 * {@link ZonedDateTime#of}, so "23:59" stays 23:59 local on days where the UTC
 * offset changes. A local time skipped by a DST gap moves forward by the
 * length of the gap; an ambiguous local time resolves to the earlier offset.
 */
@Component
public class DeadlineCalculator {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public ZoneId zoneOf(Goal goal) {
        String zone = goal.getTimeZone();
        if (zone == null || zone.isBlank()) {
            throw new GoalConfigurationException(goal.getId(), "time zone is not set");
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            throw new GoalConfigurationException(goal.getId(), "unknown time zone '" + zone + "'", e);
        }
    }

    public LocalTime deadlineOf(Goal goal) {
        return parseTimeOfDay(goal, goal.getDeadlineTime(), "deadline");
    }

    public LocalTime reminderOf(Goal goal) {
        return parseTimeOfDay(goal, goal.getReminderTime(), "reminder");
    }

    /**
     * The goal-local calendar date at the given instant.
     */
    public LocalDate localDate(Goal goal, Instant instant) {
        return instant.atZone(zoneOf(goal)).toLocalDate();
    }

    public Instant deadlineInstant(Goal goal, LocalDate date) {
        return ZonedDateTime.of(date, deadlineOf(goal), zoneOf(goal)).toInstant();
    }

    /**
     * Local dates whose deadline fell inside {@code (nowUtc - window, nowUtc]}
     * and that the goal's schedule covers, oldest first.
     */
    public List<LocalDate> dueDates(Goal goal, GoalSchedule schedule, Instant nowUtc, Duration window) {
        return occurrences(goal, schedule, deadlineOf(goal), nowUtc.minus(window), nowUtc);
    }

    /**
     * Local dates whose reminder time fell inside {@code (nowUtc - window, nowUtc]}.
     */
    public List<LocalDate> reminderDates(Goal goal, GoalSchedule schedule, Instant nowUtc, Duration window) {
        return occurrences(goal, schedule, reminderOf(goal), nowUtc.minus(window), nowUtc);
    }

    private List<LocalDate> occurrences(Goal goal, GoalSchedule schedule, LocalTime timeOfDay,
                                        Instant fromExclusive, Instant toInclusive) {
        ZoneId zone = zoneOf(goal);
        // A day earlier than the window start covers offsets that push the
        // local time of day across midnight.
        LocalDate first = fromExclusive.atZone(zone).toLocalDate().minusDays(1);
        LocalDate last = toInclusive.atZone(zone).toLocalDate();

        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
            Instant occurrence = ZonedDateTime.of(date, timeOfDay, zone).toInstant();
            if (!occurrence.isAfter(fromExclusive) || occurrence.isAfter(toInclusive)) {
                continue;
            }
            if (!goal.isActiveOn(date) || !schedule.isScheduledOn(date.getDayOfWeek())) {
                continue;
            }
            // deadlines before the goal existed are never held against it
            if (goal.getCreatedAt() != null && !occurrence.isAfter(goal.getCreatedAt())) {
                continue;
            }
            dates.add(date);
        }
        return dates;
    }

    private LocalTime parseTimeOfDay(Goal goal, String value, String what) {
        if (value == null || value.isBlank()) {
            throw new GoalConfigurationException(goal.getId(), what + " time is not set");
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new GoalConfigurationException(goal.getId(), "malformed " + what + " time '" + value + "'", e);
        }
    }
}
