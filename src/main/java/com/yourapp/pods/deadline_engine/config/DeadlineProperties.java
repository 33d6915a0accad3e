package com.yourapp.pods.deadline_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "deadline")
public class DeadlineProperties {
    private boolean enabled = true;
    private String cron = "0 */15 * * * *";
    private Duration lookback = Duration.ofMinutes(15);   // scheduler interval
    private Duration catchUp = Duration.ofHours(6);       // how long an unresolved deadline stays due
    private int parallelism = 4;
    private Duration runRetention = Duration.ofDays(30);
    private boolean remindersEnabled = true;

    @PostConstruct
    public void init() {
        if (lookback.isNegative() || lookback.isZero()) {
            throw new IllegalStateException("deadline.lookback must be positive, got " + lookback);
        }
        if (catchUp.compareTo(lookback) < 0) {
            throw new IllegalStateException("deadline.catch-up (" + catchUp + ") must not be shorter than deadline.lookback (" + lookback + ")");
        }
        if (parallelism < 1) {
            throw new IllegalStateException("deadline.parallelism must be at least 1, got " + parallelism);
        }
    }

    /**
     * Window a deadline must fall into to be evaluated on a tick.
     */
    public Duration getEvaluationWindow() {
        return catchUp.compareTo(lookback) > 0 ? catchUp : lookback;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }
    public Duration getLookback() { return lookback; }
    public void setLookback(Duration lookback) { this.lookback = lookback; }
    public Duration getCatchUp() { return catchUp; }
    public void setCatchUp(Duration catchUp) { this.catchUp = catchUp; }
    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    public Duration getRunRetention() { return runRetention; }
    public void setRunRetention(Duration runRetention) { this.runRetention = runRetention; }
    public boolean isRemindersEnabled() { return remindersEnabled; }
    public void setRemindersEnabled(boolean remindersEnabled) { this.remindersEnabled = remindersEnabled; }
}
