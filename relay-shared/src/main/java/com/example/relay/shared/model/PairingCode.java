package com.example.relay.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("pairing_codes")
public class PairingCode {
    @Id
    private String code;
    private String deviceClaim;
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;
    private boolean used;
    private String deviceId; // set once redeemed

    public boolean isActive(OffsetDateTime now) {
        return !used && expiresAt.isAfter(now);
    }
}
