package com.yourapp.pods.deadline_engine.dto;

import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class CheckInRequest {
    @NotNull
    private Long goalId;

    // defaults to COMPLETED
    private CheckInStatus status;

    @Size(max = 500)
    private String comment;

    @Size(max = 1024)
    private String proofUrl;

    private Instant clientTimestamp;
}
