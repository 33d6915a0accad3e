package com.yourapp.pods.deadline_engine.model;

import com.yourapp.pods.deadline_engine.exception.GoalConfigurationException;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Typed view of a goal's frequency settings. One implementation per
 * {@link FrequencyType}; {@link #of(Goal)} rejects settings that do not fit
 * their type instead of silently never scheduling the goal.
 */
public interface GoalSchedule {

    boolean isScheduledOn(DayOfWeek day);

    static GoalSchedule of(Goal goal) {
        FrequencyType type = goal.getFrequencyType();
        if (type == null) {
            throw new GoalConfigurationException(goal.getId(), "frequency type is not set");
        }
        switch (type) {
            case DAILY:
                return Daily.INSTANCE;
            case WEEKLY: {
                Set<DayOfWeek> days = toDaysOfWeek(goal);
                if (days.size() != 1) {
                    throw new GoalConfigurationException(goal.getId(),
                            "WEEKLY goal needs exactly one weekday but has " + goal.getFrequencyDays());
                }
                return new Weekly(days.iterator().next());
            }
            case SPECIFIC_DAYS: {
                Set<DayOfWeek> days = toDaysOfWeek(goal);
                if (days.isEmpty()) {
                    throw new GoalConfigurationException(goal.getId(), "SPECIFIC_DAYS goal has no weekdays");
                }
                return new SpecificDays(days);
            }
            default:
                throw new GoalConfigurationException(goal.getId(), "unsupported frequency type " + type);
        }
    }

    /**
     * Weekday numbers as stored on goals: 0 = Sunday through 6 = Saturday.
     */
    static DayOfWeek weekdayOf(int number) {
        if (number < 0 || number > 6) {
            throw new IllegalArgumentException("weekday number out of range: " + number);
        }
        return number == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(number);
    }

    static int numberOf(DayOfWeek day) {
        return day.getValue() % 7;
    }

    private static Set<DayOfWeek> toDaysOfWeek(Goal goal) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Integer number : goal.getFrequencyDays()) {
            if (number == null) {
                continue;
            }
            try {
                days.add(weekdayOf(number));
            } catch (IllegalArgumentException e) {
                throw new GoalConfigurationException(goal.getId(), e.getMessage(), e);
            }
        }
        return days;
    }

    final class Daily implements GoalSchedule {
        static final Daily INSTANCE = new Daily();

        private Daily() {
        }

        @Override
        public boolean isScheduledOn(DayOfWeek day) {
            return true;
        }

        @Override
        public String toString() {
            return "DAILY";
        }
    }

    final class Weekly implements GoalSchedule {
        private final DayOfWeek day;

        public Weekly(DayOfWeek day) {
            this.day = day;
        }

        public DayOfWeek getDay() {
            return day;
        }

        @Override
        public boolean isScheduledOn(DayOfWeek candidate) {
            return day == candidate;
        }

        @Override
        public String toString() {
            return "WEEKLY(" + day + ")";
        }
    }

    final class SpecificDays implements GoalSchedule {
        private final Set<DayOfWeek> days;

        public SpecificDays(Set<DayOfWeek> days) {
            this.days = Collections.unmodifiableSet(EnumSet.copyOf(days));
        }

        public Set<DayOfWeek> getDays() {
            return days;
        }

        @Override
        public boolean isScheduledOn(DayOfWeek candidate) {
            return days.contains(candidate);
        }

        @Override
        public String toString() {
            return "SPECIFIC_DAYS" + days;
        }
    }
}
