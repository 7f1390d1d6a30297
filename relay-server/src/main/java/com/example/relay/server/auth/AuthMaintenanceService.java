package com.example.relay.server.auth;

import com.example.relay.shared.aspect.Monitored;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthMaintenanceService {

    private final AuthGate authGate;

    /**
     * Drops expired unused pairing codes and expired refresh tokens.
     */
    @Monitored("scheduler")
    @Scheduled(fixedDelayString = "${relay.auth.purge-interval:300000}")
    @SchedulerLock(name = "purgeExpiredCredentials", lockAtMostFor = "PT5M")
    public void purgeExpiredCredentials() {
        int purged = authGate.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired pairing codes and refresh tokens", purged);
        }
    }
}
