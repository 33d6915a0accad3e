package com.yourapp.pods.deadline_engine.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Bookkeeping row for one (goal, date) evaluation. Lets later ticks skip dates
 * that are already settled; correctness never depends on it.
 */
@Entity
@Table(name = "evaluation_runs",
        uniqueConstraints = @UniqueConstraint(name = "uk_evaluation_runs_goal_date", columnNames = {"goal_id", "evaluation_date"}))
public class EvaluationRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "goal_id", nullable = false)
    private Long goalId;

    @Column(name = "evaluation_date", nullable = false)
    private LocalDate evaluationDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EvaluationOutcome outcome;

    private int attempts = 0;

    @Column(length = 1000)
    private String lastError;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;

    public EvaluationRun() {
    }

    public EvaluationRun(Long goalId, LocalDate evaluationDate) {
        this.goalId = goalId;
        this.evaluationDate = evaluationDate;
    }

    public Long getId() {
        return id;
    }

    public Long getGoalId() {
        return goalId;
    }

    public LocalDate getEvaluationDate() {
        return evaluationDate;
    }

    public EvaluationOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(EvaluationOutcome outcome) {
        this.outcome = outcome;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public void setEvaluatedAt(Instant evaluatedAt) {
        this.evaluatedAt = evaluatedAt;
    }

    @Transient
    public boolean isTerminal() {
        return outcome != null && outcome.isTerminal();
    }

    @Override
    public String toString() {
        return "EvaluationRun{" +
                "goalId=" + goalId +
                ", evaluationDate=" + evaluationDate +
                ", outcome=" + outcome +
                ", attempts=" + attempts +
                '}';
    }
}
