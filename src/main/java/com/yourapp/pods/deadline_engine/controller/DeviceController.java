package com.yourapp.pods.deadline_engine.controller;

import com.yourapp.pods.deadline_engine.dto.ApiResponse;
import com.yourapp.pods.deadline_engine.dto.DeviceTokenRequest;
import com.yourapp.pods.deadline_engine.model.DeviceToken;
import com.yourapp.pods.deadline_engine.service.DeviceTokenService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceTokenService deviceTokenService;

    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> register(@RequestHeader(CheckInController.USER_HEADER) Long userId,
                                                                     @Valid @RequestBody DeviceTokenRequest request) {
        DeviceToken saved = deviceTokenService.register(userId, request.getToken(), request.getPlatform());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", saved.getId());
        body.put("platform", saved.getPlatform());
        return ResponseEntity.ok(ApiResponse.ok(body));
    }

    @DeleteMapping("/{token}")
    public ResponseEntity<ApiResponse<Void>> unregister(@RequestHeader(CheckInController.USER_HEADER) Long userId,
                                                        @PathVariable String token) {
        deviceTokenService.unregister(userId, token);
        return ResponseEntity.ok(ApiResponse.ok(null));
    }
}
