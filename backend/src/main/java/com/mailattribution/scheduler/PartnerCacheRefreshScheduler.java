package com.mailattribution.scheduler;

import com.mailattribution.attribution.DataPartnerAnalyticsService;
import com.mailattribution.collector.CollectorState;
import com.mailattribution.collector.TrackingNetworkCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Keeps the lookback-window partner analytics warm between collection cycles. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "app.scheduling.partner-cache.enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PartnerCacheRefreshScheduler {

    private final TrackingNetworkCollector trackingNetworkCollector;
    private final DataPartnerAnalyticsService partnerAnalyticsService;

    @Scheduled(
            initialDelayString = "${app.scheduling.partner-cache.initial-delay:PT5M}",
            fixedDelayString = "${app.scheduling.partner-cache.interval:PT15M}")
    public void refreshPartnerCache() {
        CollectorState state = trackingNetworkCollector.getState();
        if (state != CollectorState.IDLE) {
            log.debug("Collector busy ({}), skipping partner cache refresh", state);
            return;
        }
        try {
            partnerAnalyticsService.refreshCache();
        } catch (Exception e) {
            log.error("Partner analytics cache refresh failed: {}", e.getMessage(), e);
        }
    }
}
