package com.yourapp.pods.deadline_engine.dto;

import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class CheckInResponse {
    private final Long id;
    private final Long goalId;
    private final LocalDate date;
    private final CheckInStatus status;
    private final String comment;
    private final String proofUrl;
    private final Instant createdAt;
    private final Integer currentStreak;
    private final Integer longestStreak;

    public static CheckInResponse of(CheckIn checkIn, Long goalId) {
        return new CheckInResponse(checkIn.getId(), goalId, checkIn.getDate(), checkIn.getStatus(),
            checkIn.getComment(), checkIn.getProofUrl(), checkIn.getCreatedAt(), null, null);
    }

    public static CheckInResponse of(CheckIn checkIn, Long goalId, int currentStreak, int longestStreak) {
        return new CheckInResponse(checkIn.getId(), goalId, checkIn.getDate(), checkIn.getStatus(),
            checkIn.getComment(), checkIn.getProofUrl(), checkIn.getCreatedAt(), currentStreak, longestStreak);
    }
}
