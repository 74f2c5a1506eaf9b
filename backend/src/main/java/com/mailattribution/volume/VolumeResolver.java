package com.mailattribution.volume;

import com.mailattribution.cache.CacheEntry;
import com.mailattribution.cache.DateRange;
import com.mailattribution.cache.ReportCaches;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.DailySendStat;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.PartnerCatalog;
import com.mailattribution.config.AppProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Answers how many sends went to each data set in a window.
 *
 * <p>Strategies are consulted in order (contact export, segment, list) and the first non-empty
 * result is cached: exact results for the exact TTL, everything else for the estimated TTL.
 * Empty results are never cached. When every strategy comes up empty the periodic list volume
 * from the last sending-platform sync is used.
 */
@Slf4j
@Service
public class VolumeResolver {

    private final List<VolumeStrategy> strategies;
    private final ReportCaches reportCaches;
    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final PartnerCatalog partnerCatalog;
    private final AppProperties.Volume volumeProperties;
    private final Clock clock;

    private final AtomicReference<VolumeResult> periodicVolume =
            new AtomicReference<>(VolumeResult.empty());
    private final AtomicLong periodicTotalSends = new AtomicLong();

    public VolumeResolver(
            List<VolumeStrategy> strategies,
            ReportCaches reportCaches,
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            PartnerCatalog partnerCatalog,
            AppProperties appProperties,
            Clock clock) {
        this.strategies = List.copyOf(strategies);
        this.reportCaches = reportCaches;
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.partnerCatalog = partnerCatalog;
        this.volumeProperties = appProperties.getVolume();
        this.clock = clock;
    }

    public VolumeResult resolve(DateRange range) {
        Optional<CacheEntry<VolumeResult>> cached = reportCaches.volume().getEntry(range.key());
        if (cached.isPresent()) {
            log.debug(
                    "Volume cache hit for {} ({}, {} data sets)",
                    range,
                    cached.get().getValue().getSource(),
                    cached.get().getValue().size());
            return cached.get().getValue();
        }

        for (VolumeStrategy strategy : strategies) {
            Optional<VolumeResult> result;
            try {
                result = strategy.resolve(range);
            } catch (RuntimeException e) {
                log.warn("Volume strategy {} failed for {}: {}", strategy.name(), range, e.getMessage());
                continue;
            }
            if (result.isPresent() && !result.get().isEmpty()) {
                VolumeResult volume = result.get();
                Duration ttl = ttlFor(volume);
                if (!ttl.isNegative() && !ttl.isZero()) {
                    reportCaches.volume().put(range.key(), volume, ttl);
                }
                log.info(
                        "Resolved volume for {} via {}: {} data sets, {} sends",
                        range,
                        strategy.name(),
                        volume.size(),
                        volume.total());
                return volume;
            }
        }

        VolumeResult fallback = periodicVolume.get();
        if (!fallback.isEmpty()) {
            log.info("No strategy resolved volume for {}, using periodic list volume", range);
        } else {
            log.warn("No volume available for {}", range);
        }
        return fallback;
    }

    /** Exact results expire {@code exactTtl} after they were resolved, not after they were loaded. */
    Duration ttlFor(VolumeResult volume) {
        if (!volume.isExact()) {
            return volumeProperties.getEstimatedTtl();
        }
        if (volume.getResolvedAt() == null) {
            return volumeProperties.getExactTtl();
        }
        return Duration.between(
                clock.instant(), volume.getResolvedAt().plus(volumeProperties.getExactTtl()));
    }

    /**
     * Total sends in the window: the larger of daily pipeline sends and list-level sends, falling
     * back to the last periodic total when both are zero.
     */
    public long resolveTotalSends(DateRange range) {
        return reportCaches.totalSends().getOrFetch(range.key(), () -> fetchTotalSends(range));
    }

    private long fetchTotalSends(DateRange range) {
        long pipelineTotal = 0;
        try {
            List<DailySendStat> daily =
                    sendingPlatformCalls.call(
                            "getDailyStats",
                            () -> sendingPlatformClient.getDailyStats(range.getFrom(), range.getTo()));
            pipelineTotal = daily.stream().mapToLong(DailySendStat::getSent).sum();
        } catch (RuntimeException e) {
            log.warn("Failed to fetch daily send stats for {}: {}", range, e.getMessage());
        }

        long listTotal = 0;
        try {
            List<SendReportRow> rows =
                    sendingPlatformCalls.call(
                            "getSendsByList",
                            () -> sendingPlatformClient.getSendsByList(range.getFrom(), range.getTo()));
            listTotal = rows.stream().mapToLong(SendReportRow::getSent).sum();
        } catch (RuntimeException e) {
            log.warn("Failed to fetch list sends for {}: {}", range, e.getMessage());
        }

        long best = Math.max(pipelineTotal, listTotal);
        log.info(
                "Total sends for {}: pipeline={}, list={}, using={}",
                range,
                pipelineTotal,
                listTotal,
                best);

        if (best == 0 && periodicTotalSends.get() > 0) {
            best = periodicTotalSends.get();
            log.info("Using periodic total {} as fallback for {}", best, range);
        }
        return best;
    }

    /**
     * Builds the volume view for one analytics build. Total sends come from {@link
     * #resolveTotalSends}, then {@code espSentFallback}, then the sum of resolved volume.
     */
    public PartnerVolumeView viewFor(
            DateRange range,
            Set<String> knownPrefixes,
            long grandTotalClicks,
            long grandTotalConversions,
            long espSentFallback) {
        VolumeResult volume = resolve(range);

        long totalSends = resolveTotalSends(range);
        if (totalSends == 0) {
            totalSends = espSentFallback;
        }
        if (totalSends == 0) {
            totalSends = volume.total();
        }
        log.debug("Total ESP sends for {}: {}", range, totalSends);

        return new PartnerVolumeView(
                volume,
                partnerCatalog,
                knownPrefixes,
                volumeProperties.getMinDistinctIdentifiers(),
                new ProportionalVolumeEstimator(totalSends, grandTotalClicks, grandTotalConversions));
    }

    /** Records the list volume and total sends of the latest periodic sending-platform sync. */
    public void recordPeriodicVolume(VolumeResult listVolume, long totalSends) {
        if (listVolume != null && !listVolume.isEmpty()) {
            periodicVolume.set(listVolume);
        }
        if (totalSends > 0) {
            periodicTotalSends.set(totalSends);
        }
    }

    public long getPeriodicTotalSends() {
        return periodicTotalSends.get();
    }
}
