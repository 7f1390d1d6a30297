package com.example.relay.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Relay between remote devices and the controllers watching them.
 *
 * - One authoritative WebSocket session per device; newer sessions supersede older ones
 * - Presence derived from session lifecycle and pushed to controllers
 * - Per-device FIFO command queue that survives disconnects
 * - Best-effort live media fan-out with drop-oldest buffering per controller
 */
@SpringBootApplication(scanBasePackages = "com.example.relay")
public class RelayServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayServerApplication.class, args);
    }
}
