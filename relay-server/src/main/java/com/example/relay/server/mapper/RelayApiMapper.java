package com.example.relay.server.mapper;

import com.example.relay.server.auth.AuthTokens;
import com.example.relay.server.auth.ControllerRegistration;
import com.example.relay.server.auth.PairingCodeGrant;
import com.example.relay.server.auth.PairingResult;
import com.example.relay.server.dto.CommandResponse;
import com.example.relay.server.dto.ControllerResponse;
import com.example.relay.server.dto.DeviceResponse;
import com.example.relay.server.dto.PairingCodeResponse;
import com.example.relay.server.dto.PairingCodeStatusResponse;
import com.example.relay.server.dto.PairingResponse;
import com.example.relay.server.dto.RelayStatsResponse;
import com.example.relay.server.dto.TokenResponse;
import com.example.relay.server.presence.DeviceStatusView;
import com.example.relay.server.session.RegistryStats;
import com.example.relay.shared.model.Command;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.model.PairingCode;
import com.example.relay.shared.util.JsonUtils;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.OffsetDateTime;

@Mapper(componentModel = "spring", imports = { JsonUtils.class })
public interface RelayApiMapper {

    PairingCodeResponse toPairingCodeResponse(PairingCodeGrant grant);

    @Mapping(source = "pairingCode.code", target = "code")
    @Mapping(source = "pairingCode.used", target = "used")
    @Mapping(source = "pairingCode.expiresAt", target = "expiresAt")
    @Mapping(source = "valid", target = "valid")
    PairingCodeStatusResponse toPairingCodeStatusResponse(PairingCode pairingCode, boolean valid);

    @Mapping(source = "tokens.accessToken", target = "accessToken")
    @Mapping(source = "tokens.refreshToken", target = "refreshToken")
    @Mapping(source = "tokens.expiresIn", target = "expiresIn")
    PairingResponse toPairingResponse(PairingResult result);

    TokenResponse toTokenResponse(AuthTokens tokens);

    @Mapping(source = "tokens.accessToken", target = "accessToken")
    @Mapping(source = "tokens.refreshToken", target = "refreshToken")
    @Mapping(source = "tokens.expiresIn", target = "expiresIn")
    ControllerResponse toControllerResponse(ControllerRegistration registration);

    @Mapping(source = "device.id", target = "deviceId")
    @Mapping(source = "device.name", target = "name")
    @Mapping(source = "view.presence", target = "presence")
    @Mapping(source = "view.lastSeen", target = "lastSeen")
    @Mapping(source = "view.status", target = "status")
    @Mapping(target = "settings", expression = "java(JsonUtils.parseObject(device.getSettings()))")
    @Mapping(target = "deviceInfo", expression = "java(JsonUtils.parseObject(device.getDeviceInfo()))")
    @Mapping(source = "device.createdAt", target = "createdAt")
    DeviceResponse toDeviceResponse(Device device, DeviceStatusView view);

    @Mapping(source = "command.id", target = "id")
    @Mapping(source = "command.deviceId", target = "deviceId")
    @Mapping(source = "command.action", target = "action")
    @Mapping(target = "params", expression = "java(JsonUtils.parseObject(command.getParams()))")
    @Mapping(target = "status", expression = "java(command.getStatus().wireName())")
    @Mapping(source = "command.error", target = "error")
    @Mapping(source = "queuePosition", target = "queuePosition")
    @Mapping(source = "command.createdAt", target = "createdAt")
    @Mapping(source = "command.deliveredAt", target = "deliveredAt")
    @Mapping(source = "command.completedAt", target = "completedAt")
    CommandResponse toCommandResponse(Command command, Long queuePosition);

    @Mapping(source = "podName", target = "podName")
    @Mapping(source = "timestamp", target = "timestamp")
    RelayStatsResponse toRelayStatsResponse(RegistryStats stats, String podName, OffsetDateTime timestamp);
}
