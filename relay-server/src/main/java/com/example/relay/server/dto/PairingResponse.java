package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code deviceSecret} is only ever returned here; the server keeps its hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairingResponse {

    private String deviceId;
    private String deviceSecret;
    private String accessToken;
    private String refreshToken;
    private long expiresIn;
}
