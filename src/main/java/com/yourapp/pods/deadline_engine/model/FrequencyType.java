package com.yourapp.pods.deadline_engine.model;

/**
 * Defines how often a goal expects a check-in.
 */
public enum FrequencyType {
    /**
     * Every day
     */
    DAILY,

    /**
     * Once a week, on a single listed weekday
     */
    WEEKLY,

    /**
     * On each of the listed weekdays
     */
    SPECIFIC_DAYS
}
