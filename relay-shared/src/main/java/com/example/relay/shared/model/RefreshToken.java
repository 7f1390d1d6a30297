package com.example.relay.shared.model;

import com.example.relay.shared.util.Constants.ClientRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Server-side record of an issued refresh token, keyed by its token id, so it can be revoked.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("refresh_tokens")
public class RefreshToken {
    @Id
    private String id;
    private String subject;
    private ClientRole role;
    private String deviceId;
    private OffsetDateTime issuedAt;
    private OffsetDateTime expiresAt;
    private boolean revoked;
}
