package com.example.relay.server.session;

public record RegistryStats(int connectedDevices, int connectedControllers, int controllerSessions, int totalSessions) {
}
