package com.yourapp.pods.deadline_engine.scheduler;

import com.yourapp.pods.deadline_engine.config.DeadlineProperties;
import com.yourapp.pods.deadline_engine.service.EvaluationRunService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@RequiredArgsConstructor
public class EvaluationRunCleanupScheduler {

    private final EvaluationRunService runService;
    private final DeadlineProperties props;
    private final Clock clock;

    // daily at 3 AM
    @Scheduled(cron = "0 0 3 * * *")
    public void purgeOldRuns() {
        Instant cutoff = Instant.now(clock).minus(props.getRunRetention());
        runService.purgeOlderThan(cutoff);
    }
}
