package com.example.relay.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
public class AppProperties {

    private String podName;

    private final Auth auth = new Auth();
    private final Commands commands = new Commands();
    private final Media media = new Media();
    private final WebSocket websocket = new WebSocket();
    private final Presence presence = new Presence();

    @Data
    public static class Auth {
        @NotBlank
        private String tokenSecret = "change-me-in-production";
        @Positive
        private long accessTokenExpireMinutes = 60;
        @Positive
        private long refreshTokenExpireDays = 7;
        @Positive
        private long pairingCodeExpireMinutes = 10;
        @Positive
        private long purgeInterval = 300000L;
    }

    @Data
    public static class Commands {
        @Positive
        private long pendingTtlMinutes = 24 * 60;
        @Positive
        private long expirySweepInterval = 60000L;
        @Positive
        private int historyMaxLimit = 100;
    }

    @Data
    public static class Media {
        @Min(1)
        private int bufferSize = 8;
    }

    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";
        @Positive
        private int malformedLimit = 5;
        @Positive
        private long malformedWindow = 10000L;
        @Positive
        private int controlBufferSize = 1024;
    }

    @Data
    public static class Presence {
        @Positive
        private long statusCacheTtlMinutes = 10;
        @Positive
        private long statusCacheMaxSize = 10000;
    }
}
