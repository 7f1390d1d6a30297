package com.example.relay.server.controller;

import com.example.relay.server.command.CommandQueue;
import com.example.relay.server.device.DeviceService;
import com.example.relay.server.dto.CommandRequest;
import com.example.relay.server.dto.CommandResponse;
import com.example.relay.server.dto.DeviceResponse;
import com.example.relay.server.mapper.RelayApiMapper;
import com.example.relay.server.presence.PresenceTracker;
import com.example.relay.shared.exception.ResourceNotFoundException;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.util.Constants.CommandStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/devices")
@Slf4j
public class DeviceController {

    private final DeviceService deviceService;
    private final PresenceTracker presenceTracker;
    private final CommandQueue commandQueue;
    private final RelayApiMapper mapper;
    private final Scheduler relayWorkScheduler;

    public DeviceController(DeviceService deviceService, PresenceTracker presenceTracker, CommandQueue commandQueue,
                            RelayApiMapper mapper, @Qualifier("relayWorkScheduler") Scheduler relayWorkScheduler) {
        this.deviceService = deviceService;
        this.presenceTracker = presenceTracker;
        this.commandQueue = commandQueue;
        this.mapper = mapper;
        this.relayWorkScheduler = relayWorkScheduler;
    }

    @GetMapping
    public Mono<ResponseEntity<List<DeviceResponse>>> listDevices() {
        return blocking(() -> deviceService.listPaired().stream()
                .map(this::toResponse)
                .collect(Collectors.toList()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{deviceId}")
    public Mono<ResponseEntity<DeviceResponse>> getDeviceStatus(@PathVariable String deviceId) {
        return blocking(() -> toResponse(deviceService.getPaired(deviceId)))
                .map(ResponseEntity::ok);
    }

    @PatchMapping("/{deviceId}/settings")
    public Mono<ResponseEntity<DeviceResponse>> updateSettings(@PathVariable String deviceId,
                                                               @RequestBody Map<String, Object> settings) {
        return blocking(() -> toResponse(deviceService.updateSettings(deviceId, settings)))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{deviceId}")
    public Mono<ResponseEntity<Void>> unpair(@PathVariable String deviceId) {
        log.info("Unpair requested for device {}", deviceId);
        return Mono.fromRunnable(() -> deviceService.unpair(deviceId))
                .subscribeOn(relayWorkScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{deviceId}/commands")
    public Mono<ResponseEntity<CommandResponse>> submitCommand(@PathVariable String deviceId,
                                                               @Valid @RequestBody CommandRequest request) {
        log.info("Command '{}' submitted for device {}", request.getAction(), deviceId);
        return blocking(() -> {
                    deviceService.getPaired(deviceId);
                    var queued = commandQueue.enqueue(deviceId, request.getAction(), request.getParams());
                    return mapper.toCommandResponse(queued.command(), queued.queuePosition());
                })
                .map(response -> ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
    }

    @GetMapping("/{deviceId}/commands")
    public Mono<ResponseEntity<List<CommandResponse>>> commandHistory(@PathVariable String deviceId,
                                                                      @RequestParam(required = false) String status,
                                                                      @RequestParam(defaultValue = "50") int limit,
                                                                      @RequestParam(defaultValue = "0") int offset) {
        CommandStatus filter = status == null ? null : CommandStatus.fromWire(status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown command status: " + status));
        return blocking(() -> commandQueue.history(deviceId, filter, limit, offset).stream()
                .map(command -> mapper.toCommandResponse(command, null))
                .collect(Collectors.toList()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{deviceId}/commands/{commandId}")
    public Mono<ResponseEntity<CommandResponse>> commandStatus(@PathVariable String deviceId,
                                                               @PathVariable Long commandId) {
        return blocking(() -> commandQueue.find(commandId)
                .filter(command -> command.getDeviceId().equals(deviceId))
                .map(command -> mapper.toCommandResponse(command, commandQueue.queuePosition(commandId).orElse(null)))
                .orElseThrow(() -> new ResourceNotFoundException("Command " + commandId + " not found for device " + deviceId)))
                .map(ResponseEntity::ok);
    }

    private DeviceResponse toResponse(Device device) {
        return mapper.toDeviceResponse(device, presenceTracker.view(device));
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(relayWorkScheduler);
    }
}
