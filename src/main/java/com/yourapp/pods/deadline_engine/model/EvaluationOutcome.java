package com.yourapp.pods.deadline_engine.model;

/**
 * What the deadline evaluator concluded for one goal on one local date.
 */
public enum EvaluationOutcome {
    /**
     * The evaluator wrote the MISSED check-in and reset the streak
     */
    MISSED_RECORDED,

    /**
     * A check-in already existed, or another writer won the insert
     */
    ALREADY_RESOLVED,

    /**
     * The attempt failed and the date stays due on later ticks
     */
    FAILED;

    public boolean isTerminal() {
        return this != FAILED;
    }
}
