package com.example.relay.server.media;

import com.example.relay.server.message.LocationMessage;
import com.example.relay.server.message.OutboundMessage;
import com.example.relay.server.message.RelayMessageFactory;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.Session;
import com.example.relay.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fans device media out to every controller watching the device. Best effort: each controller
 * has its own drop-oldest buffer, nothing is stored and nothing is retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MediaRouter {

    private final ConnectionRegistry registry;
    private final RelayMessageFactory messageFactory;
    private final MonitoringConfig.RelayMetricsCollector metricsCollector;

    /**
     * Offers the frame to every controller session of the device. Frames from a session that
     * is no longer the device's current one are dropped.
     *
     * @return number of controller sessions the frame was offered to
     */
    public int publish(Session session, MediaFrame frame) {
        if (!registry.isCurrentDeviceSession(session)) {
            log.debug("Dropping {} #{} from stale session {}", frame.kind(), frame.sequence(), session.getId());
            metricsCollector.incrementCounter("relay.media.dropped", "reason", "stale-session");
            return 0;
        }
        List<Session> controllers = registry.lookupControllerSessions(session.getDeviceId());
        if (controllers.isEmpty()) {
            return 0;
        }
        OutboundMessage message = messageFactory.media(session.getDeviceId(), frame);
        int offered = 0;
        for (Session controller : controllers) {
            if (controller.sendMedia(message)) {
                offered++;
            }
        }
        return offered;
    }

    /**
     * Location updates take the control channel, so controllers never lose one to the media buffer.
     */
    public int relayLocation(Session session, LocationMessage location) {
        if (!registry.isCurrentDeviceSession(session)) {
            log.debug("Dropping location from stale session {}", session.getId());
            return 0;
        }
        OutboundMessage message = messageFactory.location(session.getDeviceId(), location);
        int sent = 0;
        for (Session controller : registry.lookupControllerSessions(session.getDeviceId())) {
            if (controller.send(message)) {
                sent++;
            } else {
                registry.dropUnresponsive(controller);
            }
        }
        return sent;
    }
}
