package com.yourapp.pods.deadline_engine.controller;

import com.yourapp.pods.deadline_engine.dto.ApiResponse;
import com.yourapp.pods.deadline_engine.dto.CheckInRequest;
import com.yourapp.pods.deadline_engine.dto.CheckInResponse;
import com.yourapp.pods.deadline_engine.dto.TodayStatusResponse;
import com.yourapp.pods.deadline_engine.service.CheckInService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/checkins")
@RequiredArgsConstructor
public class CheckInController {

    // set by the identity gateway in front of this service
    static final String USER_HEADER = "X-User-Id";

    private final CheckInService checkInService;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<ApiResponse<CheckInResponse>> checkIn(@RequestHeader(USER_HEADER) Long userId,
                                                                @Valid @RequestBody CheckInRequest request) {
        CheckInResponse response = checkInService.checkIn(
                request.getGoalId(),
                userId,
                request.getStatus(),
                request.getComment(),
                request.getProofUrl(),
                request.getClientTimestamp(),
                Instant.now(clock));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/{goalId}")
    public ResponseEntity<ApiResponse<List<CheckInResponse>>> list(@RequestHeader(USER_HEADER) Long userId,
                                                                   @PathVariable Long goalId,
                                                                   @RequestParam(defaultValue = "30") int limit,
                                                                   @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(ApiResponse.ok(checkInService.listCheckIns(goalId, userId, limit, offset)));
    }

    @GetMapping("/today/{goalId}")
    public ResponseEntity<ApiResponse<TodayStatusResponse>> today(@RequestHeader(USER_HEADER) Long userId,
                                                                  @PathVariable Long goalId) {
        return ResponseEntity.ok(ApiResponse.ok(checkInService.todayStatus(goalId, userId, Instant.now(clock))));
    }
}
