package com.example.relay.server.media;

import com.example.relay.server.message.FrameMessage;
import com.example.relay.server.message.LocationMessage;
import com.example.relay.server.session.CloseReason;
import com.example.relay.server.session.Session;
import com.example.relay.server.session.SinkTransport;
import com.example.relay.server.support.RecordingTransport;
import com.example.relay.server.support.RelayTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class MediaRouterTest {

    private RelayTestContext ctx;
    private MediaRouter router;

    @BeforeEach
    void setUp() {
        ctx = new RelayTestContext();
        router = ctx.mediaRouter;
        ctx.pairedDevice("dev-1");
    }

    @Test
    void framesReachEveryControllerOfTheDevice() {
        RecordingTransport first = new RecordingTransport();
        RecordingTransport second = new RecordingTransport();
        ctx.registry.admitController("ctl-1", "dev-1", first);
        ctx.registry.admitController("ctl-2", "dev-1", second);
        Session device = ctx.registry.admitDevice("dev-1", new RecordingTransport());

        for (long i = 1; i <= 100; i++) {
            assertThat(router.publish(device, frame(i))).isEqualTo(2);
        }

        assertThat(first.mediaMessages()).hasSize(100);
        assertThat(second.mediaMessages()).extracting(m -> ((Number) m.get("sequence")).longValue())
                .startsWith(1L).endsWith(100L).isSorted();
        assertThat(first.mediaMessages().get(0)).containsEntry("type", "frame").containsEntry("data", "AAAA");
    }

    @Test
    void slowControllerLosesOldestFramesWithoutBlockingOthers() {
        SinkTransport slow = new SinkTransport("slow", 8, 64);
        RecordingTransport fast = new RecordingTransport();
        ctx.registry.admitController("ctl-slow", "dev-1", slow);
        ctx.registry.admitController("ctl-fast", "dev-1", fast);
        Session device = ctx.registry.admitDevice("dev-1", new RecordingTransport());
        List<String> received = new ArrayList<>();

        StepVerifier.create(slow.outbound(), 0)
                .then(() -> {
                    for (long i = 1; i <= 100; i++) {
                        router.publish(device, frame(i));
                    }
                    slow.close(CloseReason.NORMAL);
                })
                .thenRequest(Long.MAX_VALUE)
                .thenConsumeWhile(received::add)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(fast.mediaMessages()).hasSize(100);
        List<String> frames = received.stream().filter(text -> text.contains("\"type\":\"frame\"")).collect(Collectors.toList());
        assertThat(frames.size()).isLessThanOrEqualTo(9);
        assertThat(frames.get(frames.size() - 1)).contains("\"sequence\":100");
        assertThat(frames.get(frames.size() - 8)).contains("\"sequence\":93");
    }

    @Test
    void framesFromASupersededSessionAreDropped() {
        RecordingTransport controller = new RecordingTransport();
        ctx.registry.admitController("ctl-1", "dev-1", controller);
        Session stale = ctx.registry.admitDevice("dev-1", new RecordingTransport());
        Session current = ctx.registry.admitDevice("dev-1", new RecordingTransport());

        assertThat(router.publish(stale, frame(1))).isZero();
        assertThat(router.publish(current, frame(2))).isEqualTo(1);

        assertThat(controller.mediaMessages()).extracting(m -> ((Number) m.get("sequence")).longValue())
                .containsExactly(2L);
        assertThat(ctx.metrics.getCounterValue("relay.media.dropped", "reason", "stale-session")).isEqualTo(1);
    }

    @Test
    void locationTakesTheControlChannel() {
        RecordingTransport controller = new RecordingTransport();
        ctx.registry.admitController("ctl-1", "dev-1", controller);
        Session device = ctx.registry.admitDevice("dev-1", new RecordingTransport());

        int sent = router.relayLocation(device, new LocationMessage(1L, 52.5, 13.4, null, 5.0, null, null, 1700000000000L));

        assertThat(sent).isEqualTo(1);
        Map<String, Object> location = controller.sentOfType("location").get(0);
        assertThat(location).containsEntry("latitude", 52.5).containsEntry("deviceId", "dev-1");
        assertThat(controller.mediaMessages()).isEmpty();
    }

    @Test
    void stalledControllerIsDroppedOnceItsControlQueueIsFull() {
        SinkTransport stalled = new SinkTransport("stalled", 8, 16);
        RecordingTransport healthy = new RecordingTransport();
        ctx.registry.admitController("ctl-stalled", "dev-1", stalled);
        ctx.registry.admitController("ctl-healthy", "dev-1", healthy);
        Session device = ctx.registry.admitDevice("dev-1", new RecordingTransport());

        for (int i = 0; i < 1000; i++) {
            router.relayLocation(device, new LocationMessage(null, 52.5, 13.4, null, null, null, null, (long) i));
        }

        assertThat(stalled.isOpen()).isFalse();
        assertThat(stalled.closeReason()).isEqualTo(CloseReason.TRANSPORT_FAILURE);
        assertThat(ctx.registry.lookupControllerSessions("dev-1")).extracting(Session::getIdentity)
                .containsExactly("ctl-healthy");
        assertThat(healthy.sentOfType("location")).hasSize(1000);
        assertThat(ctx.metrics.getCounterValue("relay.sessions.dropped")).isEqualTo(1);
    }

    private MediaFrame frame(long sequence) {
        return MediaFrame.of(new FrameMessage(null, sequence, "AAAA", 640, 480, 80, null), ctx.clock.millis());
    }
}
