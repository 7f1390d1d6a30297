package com.example.relay.shared.model;

import com.example.relay.shared.util.Constants.DevicePresence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * A paired device. Created when a pairing code is redeemed and never deleted:
 * unpairing only sets {@code unpaired}. Presence and last-seen belong to the presence tracker.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("devices")
public class Device {
    @Id
    private String id;
    private String name;
    private String secretHash;
    private DevicePresence presence;
    private OffsetDateTime lastSeen;
    private String deviceInfo; // JSON object
    private String currentStatus; // JSON object, last reported by the device
    private String settings; // JSON object
    private boolean unpaired;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
