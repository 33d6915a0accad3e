package com.yourapp.pods.deadline_engine.exception;

/**
 * A goal row carries data the evaluator cannot interpret (unknown time zone,
 * unparseable deadline, inconsistent weekday set). Needs manual correction;
 * retrying will not help.
 */
public class GoalConfigurationException extends RuntimeException {

    private final Long goalId;

    public GoalConfigurationException(Long goalId, String message) {
        super("Goal " + goalId + ": " + message);
        this.goalId = goalId;
    }

    public GoalConfigurationException(Long goalId, String message, Throwable cause) {
        super("Goal " + goalId + ": " + message, cause);
        this.goalId = goalId;
    }

    public Long getGoalId() {
        return goalId;
    }
}
