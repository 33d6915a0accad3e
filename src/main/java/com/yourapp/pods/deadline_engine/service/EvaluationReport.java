package com.yourapp.pods.deadline_engine.service;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one evaluator tick.
 */
public class EvaluationReport {

    public enum Result {
        /** no deadline of the goal fell into the window */
        NOT_DUE,
        /** a terminal evaluation for the date was already on record */
        SKIPPED,
        MISSED_RECORDED,
        ALREADY_RESOLVED,
        CONFIGURATION_ERROR,
        FAILED
    }

    private final Instant nowUtc;
    private final int goalsScanned;
    private final Map<Result, Integer> counts;
    private final List<Long> misconfiguredGoalIds;
    private final boolean aborted;

    public EvaluationReport(Instant nowUtc, int goalsScanned, Map<Result, Integer> counts,
                            List<Long> misconfiguredGoalIds, boolean aborted) {
        this.nowUtc = nowUtc;
        this.goalsScanned = goalsScanned;
        EnumMap<Result, Integer> copy = new EnumMap<>(Result.class);
        for (Result result : Result.values()) {
            copy.put(result, counts.getOrDefault(result, 0));
        }
        this.counts = Collections.unmodifiableMap(copy);
        this.misconfiguredGoalIds = List.copyOf(misconfiguredGoalIds);
        this.aborted = aborted;
    }

    public Instant getNowUtc() {
        return nowUtc;
    }

    public int getGoalsScanned() {
        return goalsScanned;
    }

    public int count(Result result) {
        return counts.get(result);
    }

    public int getMissedRecorded() {
        return count(Result.MISSED_RECORDED);
    }

    public int getFailures() {
        return count(Result.FAILED);
    }

    public int getConfigurationErrors() {
        return count(Result.CONFIGURATION_ERROR);
    }

    public List<Long> getMisconfiguredGoalIds() {
        return misconfiguredGoalIds;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * True when the tick stopped early or every goal it looked at failed, so
     * its results say nothing about the health of the ledger.
     */
    public boolean isDegraded() {
        if (aborted) {
            return true;
        }
        int failures = getFailures();
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return failures > 0 && failures == total;
    }

    @Override
    public String toString() {
        return "EvaluationReport{" +
                "nowUtc=" + nowUtc +
                ", goalsScanned=" + goalsScanned +
                ", counts=" + counts +
                ", aborted=" + aborted +
                '}';
    }
}
