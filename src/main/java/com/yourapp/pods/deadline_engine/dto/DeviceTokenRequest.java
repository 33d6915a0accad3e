package com.yourapp.pods.deadline_engine.dto;

import com.yourapp.pods.deadline_engine.model.DeviceToken;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DeviceTokenRequest {
    @NotBlank
    @Size(max = 255)
    private String token;

    private DeviceToken.Platform platform;
}
