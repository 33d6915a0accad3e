package com.yourapp.pods.deadline_engine.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outcome of the most recent evaluator ticks, read by the health endpoints.
 */
@Component
public class EvaluationStatusTracker {

    public static final class Snapshot {
        private final EvaluationReport lastReport;
        private final Instant lastSuccessAt;
        private final Instant lastFailureAt;
        private final String lastFailure;

        Snapshot(EvaluationReport lastReport, Instant lastSuccessAt, Instant lastFailureAt, String lastFailure) {
            this.lastReport = lastReport;
            this.lastSuccessAt = lastSuccessAt;
            this.lastFailureAt = lastFailureAt;
            this.lastFailure = lastFailure;
        }

        public EvaluationReport getLastReport() {
            return lastReport;
        }

        public Instant getLastSuccessAt() {
            return lastSuccessAt;
        }

        public Instant getLastFailureAt() {
            return lastFailureAt;
        }

        public String getLastFailure() {
            return lastFailure;
        }

        /** true when the latest tick failed or finished with a degraded report */
        public boolean isFailing() {
            return lastFailureAt != null && (lastSuccessAt == null || lastFailureAt.isAfter(lastSuccessAt));
        }

        public List<Long> getMisconfiguredGoalIds() {
            return lastReport != null ? lastReport.getMisconfiguredGoalIds() : List.of();
        }
    }

    private final AtomicReference<Snapshot> state = new AtomicReference<>(new Snapshot(null, null, null, null));

    public void recordSuccess(EvaluationReport report) {
        state.updateAndGet(s -> new Snapshot(report, report.getNowUtc(), s.lastFailureAt, s.lastFailure));
    }

    /**
     * A tick that produced a report but cannot be trusted; counts as a failure.
     */
    public void recordDegraded(EvaluationReport report, String reason) {
        state.updateAndGet(s -> new Snapshot(report, s.lastSuccessAt, report.getNowUtc(), reason));
    }

    public void recordFailure(Instant tick, Throwable error) {
        state.updateAndGet(s -> new Snapshot(s.lastReport, s.lastSuccessAt, tick, error.getMessage()));
    }

    public Snapshot snapshot() {
        return state.get();
    }
}
