package com.yourapp.pods.deadline_engine.controller;

import com.yourapp.pods.deadline_engine.service.EvaluationReport;
import com.yourapp.pods.deadline_engine.service.EvaluationStatusTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports the deadline engine as DOWN while its latest tick failed as a whole,
 * both at {@code /api/health} and through the actuator health endpoint.
 */
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthIndicator {

    private final EvaluationStatusTracker statusTracker;
    private final Clock clock;

    @Override
    public Health health() {
        EvaluationStatusTracker.Snapshot snapshot = statusTracker.snapshot();
        Health.Builder builder = snapshot.isFailing() ? Health.down() : Health.up();
        return builder.withDetails(details(snapshot)).build();
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        EvaluationStatusTracker.Snapshot snapshot = statusTracker.snapshot();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", snapshot.isFailing() ? "DOWN" : "UP");
        response.put("timestamp", Instant.now(clock));
        response.put("service", "Deadline Engine");
        response.putAll(details(snapshot));
        HttpStatus status = snapshot.isFailing() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    private static Map<String, Object> details(EvaluationStatusTracker.Snapshot snapshot) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lastSuccessAt", snapshot.getLastSuccessAt());
        if (snapshot.getLastFailureAt() != null) {
            details.put("lastFailureAt", snapshot.getLastFailureAt());
            details.put("lastFailure", snapshot.getLastFailure());
        }
        EvaluationReport report = snapshot.getLastReport();
        if (report != null) {
            details.put("goalsScanned", report.getGoalsScanned());
            details.put("missedRecorded", report.getMissedRecorded());
            details.put("failures", report.getFailures());
        }
        details.put("misconfiguredGoalIds", snapshot.getMisconfiguredGoalIds());
        return details;
    }
}
