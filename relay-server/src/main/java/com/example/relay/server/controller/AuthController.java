package com.example.relay.server.controller;

import com.example.relay.server.auth.AuthGate;
import com.example.relay.server.dto.ControllerRequest;
import com.example.relay.server.dto.ControllerResponse;
import com.example.relay.server.dto.LoginRequest;
import com.example.relay.server.dto.PairingCodeRequest;
import com.example.relay.server.dto.PairingCodeResponse;
import com.example.relay.server.dto.PairingCodeStatusResponse;
import com.example.relay.server.dto.PairingResponse;
import com.example.relay.server.dto.RedeemRequest;
import com.example.relay.server.dto.RefreshRequest;
import com.example.relay.server.dto.TokenResponse;
import com.example.relay.server.mapper.RelayApiMapper;
import com.example.relay.shared.exception.ResourceNotFoundException;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/auth")
@Slf4j
public class AuthController {

    private final AuthGate authGate;
    private final RelayApiMapper mapper;
    private final Clock clock;
    private final Scheduler relayWorkScheduler;

    public AuthController(AuthGate authGate, RelayApiMapper mapper, Clock clock,
                          @Qualifier("relayWorkScheduler") Scheduler relayWorkScheduler) {
        this.authGate = authGate;
        this.mapper = mapper;
        this.clock = clock;
        this.relayWorkScheduler = relayWorkScheduler;
    }

    @PostMapping("/pair")
    @RateLimiter(name = "pairingCodeLimiter")
    public Mono<ResponseEntity<PairingCodeResponse>> createPairingCode(@Valid @RequestBody PairingCodeRequest request) {
        log.info("Pairing code requested for claim {}", request.getDeviceClaim());
        return Mono.fromCallable(() -> authGate.issuePairingCode(request.getDeviceClaim()))
                .subscribeOn(relayWorkScheduler)
                .map(grant -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toPairingCodeResponse(grant)));
    }

    @GetMapping("/pairing/{code}")
    public Mono<ResponseEntity<PairingCodeStatusResponse>> lookupPairingCode(@PathVariable String code) {
        return Mono.fromCallable(() -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    return authGate.lookupPairingCode(code)
                            .map(pairingCode -> mapper.toPairingCodeStatusResponse(pairingCode, pairingCode.isActive(now)))
                            .orElseThrow(() -> new ResourceNotFoundException("Pairing code not found: " + code));
                })
                .subscribeOn(relayWorkScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/redeem")
    public Mono<ResponseEntity<PairingResponse>> redeemPairingCode(@Valid @RequestBody RedeemRequest request) {
        return Mono.fromCallable(() -> authGate.redeemPairingCode(request.getCode(), request.getName(), request.getDeviceInfo()))
                .subscribeOn(relayWorkScheduler)
                .map(result -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toPairingResponse(result)));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<TokenResponse>> refresh(@Valid @RequestBody RefreshRequest request) {
        return Mono.fromCallable(() -> authGate.refresh(request.getRefreshToken()))
                .subscribeOn(relayWorkScheduler)
                .map(tokens -> ResponseEntity.ok(mapper.toTokenResponse(tokens)));
    }

    @PostMapping("/login")
    public Mono<ResponseEntity<TokenResponse>> login(@Valid @RequestBody LoginRequest request) {
        return Mono.fromCallable(() -> authGate.login(request.getDeviceId(), request.getSecret()))
                .subscribeOn(relayWorkScheduler)
                .map(tokens -> ResponseEntity.ok(mapper.toTokenResponse(tokens)));
    }

    @PostMapping("/controllers")
    public Mono<ResponseEntity<ControllerResponse>> registerController(@Valid @RequestBody ControllerRequest request) {
        log.info("Controller registration requested for device {}", request.getDeviceId());
        return Mono.fromCallable(() -> authGate.registerController(request.getDeviceId(), request.getName()))
                .subscribeOn(relayWorkScheduler)
                .map(registration -> ResponseEntity.status(HttpStatus.CREATED).body(mapper.toControllerResponse(registration)));
    }
}
