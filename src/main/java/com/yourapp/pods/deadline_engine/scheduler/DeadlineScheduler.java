package com.yourapp.pods.deadline_engine.scheduler;

import com.yourapp.pods.deadline_engine.exception.DeadlineEvaluationException;
import com.yourapp.pods.deadline_engine.service.DeadlineEvaluator;
import com.yourapp.pods.deadline_engine.service.EvaluationReport;
import com.yourapp.pods.deadline_engine.service.EvaluationStatusTracker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "deadline", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeadlineScheduler {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineScheduler.class);

    private final DeadlineEvaluator evaluator;
    private final EvaluationStatusTracker statusTracker;
    private final Clock clock;

    // every 15 minutes by default
    @Scheduled(cron = "${deadline.cron:0 */15 * * * *}")
    public void evaluateDeadlines() {
        Instant now = Instant.now(clock);
        try {
            EvaluationReport report = evaluator.evaluate(now);
            if (report.isDegraded()) {
                String reason = report.isAborted() ? "tick aborted before all goals were evaluated" : "every goal evaluation failed";
                statusTracker.recordDegraded(report, reason);
                logger.warn("Deadline tick {} degraded, {}: {}", now, reason, report);
                return;
            }
            statusTracker.recordSuccess(report);
            if (report.getMissedRecorded() > 0 || report.getFailures() > 0 || report.getConfigurationErrors() > 0) {
                logger.info("Deadline tick {}: {}", now, report);
            } else {
                logger.debug("Deadline tick {}: {}", now, report);
            }
        } catch (DeadlineEvaluationException e) {
            statusTracker.recordFailure(now, e);
            logger.error("Deadline tick {} failed", now, e);
        }
    }
}
