package com.example.relay.server.session;

/**
 * Outbound half of one client connection.
 */
public interface Transport {

    String id();

    /**
     * Queues a control frame. Control frames are never dropped while the transport is open.
     *
     * @return false if the transport refused the write (closed or failed)
     */
    boolean send(String text);

    /**
     * Offers a media frame to a bounded buffer that drops its oldest entry when full.
     * Never blocks.
     *
     * @return false only if the transport is closed
     */
    boolean sendMedia(String text);

    /**
     * Idempotent; only the first reason is kept.
     */
    void close(CloseReason reason);

    boolean isOpen();
}
