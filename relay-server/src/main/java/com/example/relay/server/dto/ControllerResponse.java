package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ControllerResponse {

    private String controllerId;
    private String deviceId;
    private String accessToken;
    private String refreshToken;
    private long expiresIn;
}
