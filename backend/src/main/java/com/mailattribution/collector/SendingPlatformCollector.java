package com.mailattribution.collector;

import com.mailattribution.attribution.CampaignEnricher;
import com.mailattribution.cache.DateRange;
import com.mailattribution.client.UpstreamCallTemplate;
import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.client.sending.DailySendStat;
import com.mailattribution.client.sending.ListInfo;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.config.AppProperties;
import com.mailattribution.monitoring.AttributionMetrics;
import com.mailattribution.volume.ListVolumeStrategy;
import com.mailattribution.volume.VolumeResolver;
import com.mailattribution.volume.VolumeResult;
import com.mailattribution.volume.VolumeSource;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Periodic sending-platform sync: campaign metadata for enrichment, plus list-level volume and
 * total sends used when range-specific volume cannot be resolved.
 */
@Slf4j
@Service
public class SendingPlatformCollector {

    private final SendingPlatformClient sendingPlatformClient;
    private final UpstreamCallTemplate sendingPlatformCalls;
    private final CampaignEnricher campaignEnricher;
    private final VolumeResolver volumeResolver;
    private final AttributionMetrics metrics;
    private final AppProperties appProperties;
    private final Clock clock;

    public SendingPlatformCollector(
            SendingPlatformClient sendingPlatformClient,
            @Qualifier("sendingPlatformCalls") UpstreamCallTemplate sendingPlatformCalls,
            CampaignEnricher campaignEnricher,
            VolumeResolver volumeResolver,
            AttributionMetrics metrics,
            AppProperties appProperties,
            Clock clock) {
        this.sendingPlatformClient = sendingPlatformClient;
        this.sendingPlatformCalls = sendingPlatformCalls;
        this.campaignEnricher = campaignEnricher;
        this.volumeResolver = volumeResolver;
        this.metrics = metrics;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public void sync() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(appProperties.getTracking().getZoneId())));
        DateRange campaignWindow = DateRange.lastDays(today, appProperties.getSending().getCampaignLookbackDays());
        DateRange volumeWindow = DateRange.lastDays(today, appProperties.getTracking().getLookbackDays());
        log.info("Starting sending platform sync (campaigns {}, volume {})", campaignWindow, volumeWindow);

        boolean complete = true;

        List<CampaignMetadata> campaigns =
                fetch(
                        "getCampaigns",
                        () -> sendingPlatformClient.getCampaigns(campaignWindow.getFrom(), campaignWindow.getTo()));
        if (campaigns != null) {
            campaignEnricher.cacheCampaigns(campaigns);
            log.info("Cached {} sending platform campaigns", campaigns.size());
        } else {
            complete = false;
        }

        VolumeResult listVolume = VolumeResult.empty();
        List<ListInfo> lists = fetch("getLists", sendingPlatformClient::getLists);
        List<SendReportRow> listSends =
                fetch(
                        "getSendsByList",
                        () -> sendingPlatformClient.getSendsByList(volumeWindow.getFrom(), volumeWindow.getTo()));
        if (lists != null && listSends != null) {
            Map<String, Long> sends = ListVolumeStrategy.sendsByDataSet(lists, listSends);
            if (!sends.isEmpty()) {
                listVolume =
                        VolumeResult.builder()
                                .sendsByDataSet(sends)
                                .source(VolumeSource.LIST)
                                .perPartnerUsable(false)
                                .resolvedAt(clock.instant())
                                .build();
            }
        } else {
            complete = false;
        }

        long espSent = 0;
        if (campaigns != null) {
            for (CampaignMetadata campaign : campaigns) {
                if (campaign.getScheduleDate() != null && volumeWindow.contains(campaign.getScheduleDate())) {
                    espSent += campaign.getSent();
                }
            }
        }

        long pipelineSent = 0;
        List<DailySendStat> daily =
                fetch(
                        "getDailyStats",
                        () -> sendingPlatformClient.getDailyStats(volumeWindow.getFrom(), volumeWindow.getTo()));
        if (daily != null) {
            for (DailySendStat stat : daily) {
                pipelineSent += stat.getSent();
            }
        } else {
            complete = false;
        }

        long totalSends = Math.max(listVolume.total(), Math.max(espSent, pipelineSent));
        volumeResolver.recordPeriodicVolume(listVolume, totalSends);
        metrics.recordSendingSync(complete ? "success" : "partial");
        log.info(
                "Sending platform sync complete: {} list data sets, total sends {} (list {}, esp {}, pipeline {})",
                listVolume.size(),
                totalSends,
                listVolume.total(),
                espSent,
                pipelineSent);
    }

    private <T> T fetch(String operation, Supplier<T> call) {
        try {
            return sendingPlatformCalls.call(operation, call);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Sending platform {} failed: {}", operation, e.getMessage());
            return null;
        }
    }
}
