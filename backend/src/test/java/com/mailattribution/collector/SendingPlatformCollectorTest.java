package com.mailattribution.collector;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.mailattribution.TestFixtures;
import com.mailattribution.attribution.CampaignEnricher;
import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.client.sending.DailySendStat;
import com.mailattribution.client.sending.ListInfo;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.UpstreamApiException;
import com.mailattribution.monitoring.AttributionMetrics;
import com.mailattribution.volume.VolumeResolver;
import com.mailattribution.volume.VolumeResult;
import com.mailattribution.volume.VolumeSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SendingPlatformCollectorTest {

    // 2026-01-27 in the tracking zone
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-27T20:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 27);

    @Mock private SendingPlatformClient sendingPlatformClient;
    @Mock private CampaignEnricher campaignEnricher;
    @Mock private VolumeResolver volumeResolver;

    private SimpleMeterRegistry meterRegistry;
    private SendingPlatformCollector collector;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = TestFixtures.appProperties();
        meterRegistry = new SimpleMeterRegistry();
        collector =
                new SendingPlatformCollector(
                        sendingPlatformClient,
                        TestFixtures.directCalls("sending-platform"),
                        campaignEnricher,
                        volumeResolver,
                        new AttributionMetrics(meterRegistry),
                        appProperties,
                        CLOCK);

        when(sendingPlatformClient.getCampaigns(any(), any()))
                .thenReturn(
                        List.of(
                                CampaignMetadata.builder()
                                        .mailingId("1")
                                        .sent(4_000)
                                        .scheduleDate(TODAY.minusDays(2))
                                        .build(),
                                CampaignMetadata.builder()
                                        .mailingId("2")
                                        .sent(9_000)
                                        .scheduleDate(TODAY.minusDays(60))
                                        .build()));
        when(sendingPlatformClient.getLists()).thenReturn(List.of(new ListInfo("10", "M77_WIT")));
        when(sendingPlatformClient.getSendsByList(any(), any()))
                .thenReturn(List.of(SendReportRow.builder().id("10").sent(2_500).build()));
        when(sendingPlatformClient.getDailyStats(any(), any()))
                .thenReturn(List.of(new DailySendStat(TODAY, 3_000, 2_900)));
    }

    @Test
    @DisplayName("A sync caches campaigns and records list volume with the largest total")
    void sync_RecordsPeriodicVolume() {
        // Act
        collector.sync();

        // Assert
        verify(campaignEnricher).cacheCampaigns(argThat(campaigns -> campaigns.size() == 2));
        ArgumentCaptor<VolumeResult> volume = ArgumentCaptor.forClass(VolumeResult.class);
        verify(volumeResolver).recordPeriodicVolume(volume.capture(), eq(4_000L));
        assertEquals(VolumeSource.LIST, volume.getValue().getSource());
        assertFalse(volume.getValue().isPerPartnerUsable());
        assertEquals(Map.of("M77_WIT", 2_500L), volume.getValue().getSendsByDataSet());
        verify(sendingPlatformClient).getCampaigns(TODAY.minusDays(90), TODAY);
        assertEquals(
                1.0, meterRegistry.get("attribution.sending.sync").tag("outcome", "success").counter().count());
    }

    @Test
    @DisplayName("A failing call marks the sync partial but the rest still runs")
    void sync_PartialOnFailure() {
        when(sendingPlatformClient.getCampaigns(any(), any())).thenThrow(new UpstreamApiException("down"));

        collector.sync();

        verify(campaignEnricher, never()).cacheCampaigns(any());
        verify(volumeResolver).recordPeriodicVolume(any(VolumeResult.class), eq(3_000L));
        assertEquals(
                1.0, meterRegistry.get("attribution.sending.sync").tag("outcome", "partial").counter().count());
    }
}
