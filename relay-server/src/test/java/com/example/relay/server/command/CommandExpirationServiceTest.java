package com.example.relay.server.command;

import com.example.relay.server.support.RelayTestContext;
import com.example.relay.shared.util.Constants.CommandStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExpirationServiceTest {

    private RelayTestContext ctx;
    private CommandExpirationService expirationService;

    @BeforeEach
    void setUp() {
        ctx = new RelayTestContext();
        ctx.properties.getCommands().setPendingTtlMinutes(60);
        expirationService = new CommandExpirationService(ctx.commandQueue, ctx.properties);
        ctx.pairedDevice("dev-1");
        ctx.pairedDevice("dev-2");
    }

    @Test
    void sweepExpiresOnlyCommandsOlderThanTheTtl() {
        Long stale = ctx.commandQueue.enqueue("dev-1", "start_camera", null).command().getId();
        ctx.clock.advance(Duration.ofMinutes(45));
        Long fresh = ctx.commandQueue.enqueue("dev-2", "get_status", null).command().getId();
        ctx.clock.advance(Duration.ofMinutes(30));

        expirationService.expirePendingCommands();

        assertThat(ctx.commandQueue.find(stale).orElseThrow().getStatus()).isEqualTo(CommandStatus.EXPIRED);
        assertThat(ctx.commandQueue.find(fresh).orElseThrow().getStatus()).isEqualTo(CommandStatus.PENDING);
        assertThat(ctx.metrics.getCounterValue("relay.commands.expired")).isEqualTo(1);
    }

    @Test
    void sweepWithNothingStaleChangesNothing() {
        Long id = ctx.commandQueue.enqueue("dev-1", "start_camera", null).command().getId();

        expirationService.expirePendingCommands();

        assertThat(ctx.commandQueue.find(id).orElseThrow().getStatus()).isEqualTo(CommandStatus.PENDING);
    }
}
