package com.example.relay.shared.model;

import com.example.relay.shared.util.Constants.CommandStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * A command addressed to one device. Ids are generated by the store and grow with
 * creation order, which is the delivery order of pending commands.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("commands")
public class Command {
    @Id
    private Long id;
    private String deviceId;
    private String action;
    private String params; // JSON object
    private CommandStatus status;
    private String error;
    private OffsetDateTime createdAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime completedAt;
}
