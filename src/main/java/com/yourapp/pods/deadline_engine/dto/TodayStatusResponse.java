package com.yourapp.pods.deadline_engine.dto;

import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class TodayStatusResponse {
    private final Long goalId;
    private final LocalDate date;
    private final boolean scheduledToday;
    private final boolean checkedIn;
    private final CheckInStatus status;
    private final Instant deadline;
    private final int currentStreak;
    private final int longestStreak;
}
