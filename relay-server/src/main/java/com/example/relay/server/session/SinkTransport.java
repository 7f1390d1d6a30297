package com.example.relay.server.session;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reactor sink backed transport. Control frames go through a unicast sink whose queue holds
 * {@code controlBufferSize} unread frames (rounded up to a power of two); a write beyond that
 * is refused. Media goes through a
 * second sink followed by a drop-oldest buffer of {@code mediaBufferSize}.
 * {@link #outbound()} merges both and is subscribed once by the WebSocket handler.
 */
@Slf4j
public class SinkTransport implements Transport {

    private final String id;
    private final Sinks.Many<String> controlSink;
    private final Sinks.Many<String> mediaSink = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.One<CloseReason> closeSink = Sinks.one();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicLong droppedMedia = new AtomicLong();
    private final Object controlLock = new Object();
    private final Object mediaLock = new Object();
    private final Flux<String> outbound;
    private volatile CloseReason closeReason;

    public SinkTransport(String id, int mediaBufferSize, int controlBufferSize) {
        this.id = id;
        this.controlSink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(controlBufferSize).get());
        Flux<String> media = mediaSink.asFlux()
                .onBackpressureBuffer(mediaBufferSize, dropped -> droppedMedia.incrementAndGet(),
                        BufferOverflowStrategy.DROP_OLDEST);
        // prefetch 1 so a stalled consumer holds at most one media frame outside the buffer
        this.outbound = Flux.merge(1, controlSink.asFlux(), media);
    }

    @Override
    public String id() {
        return id;
    }

    public Flux<String> outbound() {
        return outbound;
    }

    /**
     * Emits once, with the reason passed to the first {@link #close(CloseReason)}.
     */
    public Mono<CloseReason> closeSignal() {
        return closeSink.asMono();
    }

    @Override
    public boolean send(String text) {
        synchronized (controlLock) {
            if (!open.get()) {
                return false;
            }
            Sinks.EmitResult result = controlSink.tryEmitNext(text);
            if (result.isFailure()) {
                log.warn("Control write rejected on transport {}: {}", id, result);
                return false;
            }
            return true;
        }
    }

    @Override
    public boolean sendMedia(String text) {
        synchronized (mediaLock) {
            if (!open.get()) {
                return false;
            }
            Sinks.EmitResult result = mediaSink.tryEmitNext(text);
            if (result.isFailure()) {
                droppedMedia.incrementAndGet();
                log.debug("Media write rejected on transport {}: {}", id, result);
            }
            return true;
        }
    }

    @Override
    public void close(CloseReason reason) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        closeReason = reason;
        synchronized (controlLock) {
            controlSink.tryEmitComplete();
        }
        synchronized (mediaLock) {
            mediaSink.tryEmitComplete();
        }
        closeSink.tryEmitValue(reason);
        log.debug("Transport {} closed: {}", id, reason);
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    public CloseReason closeReason() {
        return closeReason;
    }

    public long droppedMediaCount() {
        return droppedMedia.get();
    }
}
