package com.yourapp.pods.deadline_engine.exception;

/**
 * The whole evaluator run failed, typically because the goal store could not
 * be read. Nothing is assumed lost; the next tick rescans.
 */
public class DeadlineEvaluationException extends RuntimeException {

    public DeadlineEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
