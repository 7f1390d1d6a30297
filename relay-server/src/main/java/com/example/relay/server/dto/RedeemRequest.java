package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedeemRequest {

    @NotBlank(message = "Pairing code is required")
    @Size(min = 6, max = 6, message = "Pairing code must be 6 characters")
    private String code;

    @Size(max = 100)
    private String name;

    private Map<String, Object> deviceInfo;
}
