package com.example.relay.server.session;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key (device id or pairing claim). Work for different keys never
 * contends. An entry lives only while some thread holds or waits for its lock.
 */
@Component
public class DeviceLockManager {

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        // users is only changed inside compute for its key
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.users++;
            return held;
        });
        keyLock.lock.lock();
        try {
            return action.get();
        } finally {
            keyLock.lock.unlock();
            locks.computeIfPresent(key, (k, held) -> --held.users == 0 ? null : held);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String key) {
        KeyLock keyLock = locks.get(key);
        return keyLock != null && keyLock.lock.isHeldByCurrentThread();
    }

    int size() {
        return locks.size();
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
