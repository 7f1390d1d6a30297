package com.example.relay.server.session;

/**
 * Callbacks for session lifecycle events. Invoked while the device's lock is held, so
 * implementations see admissions and removals of one device in order.
 */
public interface RegistryListener {

    default void onDeviceAdmitted(Session session) {
    }

    default void onDeviceRemoved(Session session) {
    }

    default void onControllerAdmitted(Session session) {
    }

    default void onControllerRemoved(Session session) {
    }
}
