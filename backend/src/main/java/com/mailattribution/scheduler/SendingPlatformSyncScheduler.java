package com.mailattribution.scheduler;

import com.mailattribution.collector.SendingPlatformCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Syncs sending-platform campaign metadata and periodic volume on its own ticker. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduling.sending-sync.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class SendingPlatformSyncScheduler {

    private final SendingPlatformCollector sendingPlatformCollector;

    @Scheduled(
            initialDelayString = "${app.scheduling.sending-sync.initial-delay:PT0S}",
            fixedDelayString = "${app.scheduling.sending-sync.interval:PT30M}")
    public void syncSendingPlatform() {
        try {
            sendingPlatformCollector.sync();
        } catch (Exception e) {
            log.error("Sending platform sync failed: {}", e.getMessage(), e);
        }
    }
}
