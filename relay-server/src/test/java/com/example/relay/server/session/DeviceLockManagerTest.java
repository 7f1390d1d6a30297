package com.example.relay.server.session;

import com.example.relay.server.support.RecordingTransport;
import com.example.relay.server.support.RelayTestContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceLockManagerTest {

    @Test
    void locksAreReleasedAfterABurstOfPairingsAndAdmissions() {
        RelayTestContext ctx = new RelayTestContext();

        for (int i = 0; i < 500; i++) {
            ctx.authGate.issuePairingCode("claim-" + i);
        }
        for (int i = 0; i < 200; i++) {
            ctx.pairedDevice("dev-" + i);
            Session session = ctx.registry.admitDevice("dev-" + i, new RecordingTransport());
            ctx.registry.remove(session);
        }

        assertThat(ctx.lockManager.size()).isZero();
    }

    @Test
    void nestedLockingOnOneKeyIsReentrant() {
        DeviceLockManager lockManager = new DeviceLockManager();

        boolean heldInside = lockManager.withLock("dev-1", () ->
                lockManager.withLock("dev-1", () -> lockManager.isHeldByCurrentThread("dev-1")));

        assertThat(heldInside).isTrue();
        assertThat(lockManager.isHeldByCurrentThread("dev-1")).isFalse();
        assertThat(lockManager.size()).isZero();
    }

    @Test
    void contendedKeyStaysMutuallyExclusiveAndIsEvictedAfterwards() throws Exception {
        DeviceLockManager lockManager = new DeviceLockManager();
        int[] counter = {0};
        int threads = 8;
        int rounds = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        lockManager.withLock("dev-1", () -> {
                            counter[0]++;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(counter[0]).isEqualTo(threads * rounds);
        assertThat(lockManager.size()).isZero();
    }
}
