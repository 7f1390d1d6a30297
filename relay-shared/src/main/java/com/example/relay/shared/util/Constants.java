package com.example.relay.shared.util;

import java.util.Arrays;
import java.util.Optional;

public final class Constants {

    private Constants() {}

    public static final String PAIRING_CODE_ALPHABET = "0123456789ABCDEF";
    public static final int PAIRING_CODE_LENGTH = 6;

    public static final String TOKEN_QUERY_PARAM = "token";
    public static final String BEARER_PREFIX = "Bearer ";

    public enum ClientRole {
        DEVICE,
        CONTROLLER
    }

    public enum DevicePresence {
        ONLINE,
        OFFLINE
    }

    public enum CommandStatus {
        PENDING,
        DELIVERED,
        EXECUTING,
        COMPLETED,
        FAILED,
        EXPIRED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == EXPIRED;
        }

        /**
         * Forward-only lifecycle. DELIVERED may fail directly when the device rejects
         * a command before starting it.
         */
        public boolean canTransitionTo(CommandStatus next) {
            switch (this) {
                case PENDING:
                    return next == DELIVERED || next == EXPIRED;
                case DELIVERED:
                    return next == EXECUTING || next == FAILED;
                case EXECUTING:
                    return next == COMPLETED || next == FAILED;
                default:
                    return false;
            }
        }

        public String wireName() {
            return name().toLowerCase();
        }

        public static Optional<CommandStatus> fromWire(String value) {
            if (value == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(s -> s.name().equalsIgnoreCase(value))
                    .findFirst();
        }
    }

    public enum CommandAction {
        START_CAMERA,
        STOP_CAMERA,
        SWITCH_CAMERA,
        START_AUDIO,
        STOP_AUDIO,
        CAPTURE_PHOTO,
        START_RECORDING,
        STOP_RECORDING,
        GET_LOCATION,
        GET_STATUS,
        SET_SOUND_THRESHOLD,
        ENABLE_SOUND_DETECTION,
        DISABLE_SOUND_DETECTION;

        public String wireName() {
            return name().toLowerCase();
        }

        public static Optional<CommandAction> fromWire(String value) {
            if (value == null) {
                return Optional.empty();
            }
            return Arrays.stream(values())
                    .filter(a -> a.wireName().equals(value))
                    .findFirst();
        }
    }

    public enum MediaKind {
        FRAME,
        AUDIO
    }
}
