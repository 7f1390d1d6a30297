package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControllerRequest {

    @NotBlank(message = "Device ID is required")
    private String deviceId;

    @Size(max = 100)
    private String name;
}
