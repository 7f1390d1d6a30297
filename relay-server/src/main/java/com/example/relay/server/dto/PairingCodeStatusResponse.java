package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Lookup result for a pairing code. {@code valid} is false once the code is used or expired.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairingCodeStatusResponse {

    private String code;
    private boolean valid;
    private boolean used;
    private OffsetDateTime expiresAt;
}
