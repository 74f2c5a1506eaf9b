package com.mailattribution.scheduler;

import com.mailattribution.collector.TrackingNetworkCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs tracking-network collection cycles. The first cycle after startup is a full fetch, later
 * ones are incremental.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduling.tracking-sync.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class AttributionSyncScheduler {

    private final TrackingNetworkCollector trackingNetworkCollector;

    @Scheduled(
            initialDelayString = "${app.scheduling.tracking-sync.initial-delay:PT5S}",
            fixedDelayString = "${app.scheduling.tracking-sync.interval:PT15M}")
    public void syncTrackingNetwork() {
        try {
            trackingNetworkCollector.runCycle();
        } catch (Exception e) {
            log.error("Tracking network sync failed: {}", e.getMessage(), e);
        }
    }
}
