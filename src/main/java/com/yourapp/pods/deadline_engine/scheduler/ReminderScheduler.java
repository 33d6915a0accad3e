package com.yourapp.pods.deadline_engine.scheduler;

import com.yourapp.pods.deadline_engine.config.DeadlineProperties;
import com.yourapp.pods.deadline_engine.service.ReminderService;
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
@ConditionalOnProperty(prefix = "deadline", name = "reminders-enabled", havingValue = "true", matchIfMissing = true)
public class ReminderScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ReminderScheduler.class);

    private final ReminderService reminderService;
    private final DeadlineProperties props;
    private final Clock clock;

    // same cadence as the deadline tick, reminders only look one interval back
    @Scheduled(cron = "${deadline.cron:0 */15 * * * *}")
    public void sendReminders() {
        Instant now = Instant.now(clock);
        try {
            reminderService.sendDueReminders(now, props.getLookback());
        } catch (RuntimeException e) {
            logger.error("Reminder tick {} failed", now, e);
        }
    }
}
