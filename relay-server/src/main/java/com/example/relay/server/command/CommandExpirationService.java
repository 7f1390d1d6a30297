package com.example.relay.server.command;

import com.example.relay.shared.aspect.Monitored;
import com.example.relay.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
@Slf4j
public class CommandExpirationService {

    private final CommandQueue commandQueue;
    private final AppProperties appProperties;

    /**
     * Expires pending commands older than {@code relay.commands.pending-ttl-minutes}.
     * The SchedulerLock keeps it to one instance at a time when the store is shared.
     */
    @Monitored("scheduler")
    @Scheduled(fixedDelayString = "${relay.commands.expiry-sweep-interval:60000}")
    @SchedulerLock(name = "expirePendingCommands", lockAtMostFor = "PT5M")
    public void expirePendingCommands() {
        log.debug("Checking for pending commands to expire...");
        Duration ttl = Duration.ofMinutes(appProperties.getCommands().getPendingTtlMinutes());
        int expired = commandQueue.expireAll(ttl);
        if (expired > 0) {
            log.info("Expired {} pending commands older than {}", expired, ttl);
        }
    }
}
