package com.mailattribution.cache;

import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.config.AppProperties;
import com.mailattribution.model.Conversion;
import com.mailattribution.volume.VolumeResult;
import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Component;

/** Range-keyed caches for on-demand partner analytics and volume resolution. */
@Component
public class ReportCaches {

    private final CacheStore<String, EntityReport> partnerClicks;
    private final CacheStore<String, EntityReport> offerPartnerClicks;
    private final CacheStore<String, List<Conversion>> conversions;
    private final CacheStore<String, VolumeResult> volume;
    private final CacheStore<String, Long> totalSends;

    public ReportCaches(AppProperties appProperties, Clock clock) {
        AppProperties.Volume volumeProps = appProperties.getVolume();
        this.partnerClicks =
                new CacheStore<>(
                        "partner-clicks",
                        clock,
                        appProperties.getReportCache().getTtl(),
                        report -> report != null && !report.isEmpty());
        this.offerPartnerClicks =
                new CacheStore<>(
                        "offer-partner-clicks",
                        clock,
                        appProperties.getReportCache().getTtl(),
                        report -> report != null && !report.isEmpty());
        this.conversions =
                new CacheStore<>(
                        "range-conversions", clock, appProperties.getReportCache().getTtl());
        this.volume =
                new CacheStore<>(
                        "volume",
                        clock,
                        volumeProps.getEstimatedTtl(),
                        result -> result != null && !result.isEmpty());
        this.totalSends =
                new CacheStore<>(
                        "total-sends",
                        clock,
                        volumeProps.getTotalSendsTtl(),
                        total -> total != null && total > 0);
    }

    /** sub2 report per range */
    public CacheStore<String, EntityReport> partnerClicks() {
        return partnerClicks;
    }

    /** offer x sub2 report per range */
    public CacheStore<String, EntityReport> offerPartnerClicks() {
        return offerPartnerClicks;
    }

    public CacheStore<String, List<Conversion>> conversions() {
        return conversions;
    }

    /** Sends per data-set code per range */
    public CacheStore<String, VolumeResult> volume() {
        return volume;
    }

    public CacheStore<String, Long> totalSends() {
        return totalSends;
    }

    public void evictExpired() {
        partnerClicks.evictExpired();
        offerPartnerClicks.evictExpired();
        conversions.evictExpired();
        volume.evictExpired();
        totalSends.evictExpired();
    }
}
