package com.mailattribution.volume;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.mailattribution.TestFixtures;
import com.mailattribution.cache.DateRange;
import com.mailattribution.cache.ReportCaches;
import com.mailattribution.client.sending.DailySendStat;
import com.mailattribution.client.sending.SendReportRow;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.PartnerCatalog;
import com.mailattribution.config.AppProperties;
import com.mailattribution.exception.UpstreamApiException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VolumeResolverTest {

    private static final DateRange RANGE =
            DateRange.of(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock private VolumeStrategy exportStrategy;
    @Mock private VolumeStrategy segmentStrategy;
    @Mock private SendingPlatformClient sendingPlatformClient;

    private VolumeResolver resolver;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = TestFixtures.appProperties();
        when(exportStrategy.name()).thenReturn("contact-export");
        when(segmentStrategy.name()).thenReturn("segment");
        resolver =
                new VolumeResolver(
                        List.of(exportStrategy, segmentStrategy),
                        new ReportCaches(appProperties, CLOCK),
                        sendingPlatformClient,
                        TestFixtures.directCalls("sending-platform"),
                        new PartnerCatalog(appProperties),
                        appProperties,
                        CLOCK);
    }

    private static VolumeResult segmentVolume(Map<String, Long> sends) {
        return VolumeResult.builder()
                .sendsByDataSet(sends)
                .source(VolumeSource.SEGMENT)
                .perPartnerUsable(true)
                .resolvedAt(CLOCK.instant())
                .build();
    }

    @Test
    @DisplayName("The first non-empty strategy answers and its result is cached")
    void resolve_FirstNonEmptyWinsAndIsCached() {
        // Arrange
        VolumeResult segment = segmentVolume(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L));
        when(exportStrategy.resolve(RANGE)).thenReturn(Optional.empty());
        when(segmentStrategy.resolve(RANGE)).thenReturn(Optional.of(segment));

        // Act
        VolumeResult first = resolver.resolve(RANGE);
        VolumeResult second = resolver.resolve(RANGE);

        // Assert
        assertSame(segment, first);
        assertSame(segment, second);
        verify(segmentStrategy, times(1)).resolve(RANGE);
    }

    @Test
    @DisplayName("A failing strategy is skipped")
    void resolve_FailingStrategySkipped() {
        VolumeResult segment = segmentVolume(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L));
        when(exportStrategy.resolve(RANGE)).thenThrow(new UpstreamApiException("boom"));
        when(segmentStrategy.resolve(RANGE)).thenReturn(Optional.of(segment));

        assertSame(segment, resolver.resolve(RANGE));
    }

    @Test
    @DisplayName("When every strategy is empty the periodic list volume is used and nothing is cached")
    void resolve_PeriodicFallback() {
        when(exportStrategy.resolve(RANGE)).thenReturn(Optional.empty());
        when(segmentStrategy.resolve(RANGE)).thenReturn(Optional.empty());
        VolumeResult listVolume =
                VolumeResult.builder()
                        .sendsByDataSet(Map.of("M77_WIT", 10L))
                        .source(VolumeSource.LIST)
                        .perPartnerUsable(false)
                        .build();
        resolver.recordPeriodicVolume(listVolume, 5000);

        assertSame(listVolume, resolver.resolve(RANGE));
        resolver.resolve(RANGE);
        verify(segmentStrategy, times(2)).resolve(RANGE);
    }

    @Test
    @DisplayName("Total sends take the larger of pipeline and list totals")
    void resolveTotalSends_Max() {
        when(sendingPlatformClient.getDailyStats(RANGE.getFrom(), RANGE.getTo()))
                .thenReturn(
                        List.of(
                                new DailySendStat(LocalDate.of(2026, 1, 1), 1000, 990),
                                new DailySendStat(LocalDate.of(2026, 1, 2), 500, 495)));
        when(sendingPlatformClient.getSendsByList(RANGE.getFrom(), RANGE.getTo()))
                .thenReturn(List.of(SendReportRow.builder().id("1").sent(1200).build()));

        assertEquals(1500, resolver.resolveTotalSends(RANGE));
    }

    @Test
    @DisplayName("Total sends fall back to the periodic total when both sources fail")
    void resolveTotalSends_PeriodicFallback() {
        when(sendingPlatformClient.getDailyStats(RANGE.getFrom(), RANGE.getTo()))
                .thenThrow(new UpstreamApiException("down"));
        when(sendingPlatformClient.getSendsByList(RANGE.getFrom(), RANGE.getTo()))
                .thenThrow(new UpstreamApiException("down"));
        resolver.recordPeriodicVolume(VolumeResult.empty(), 7000);

        assertEquals(7000, resolver.resolveTotalSends(RANGE));
    }

    @Test
    @DisplayName("Matching per-partner volume is used; partners without codes get a click-share estimate")
    void viewFor_MatchingVolume() {
        // Arrange
        when(exportStrategy.resolve(RANGE)).thenReturn(Optional.empty());
        when(segmentStrategy.resolve(RANGE))
                .thenReturn(
                        Optional.of(
                                segmentVolume(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L))));
        when(sendingPlatformClient.getDailyStats(RANGE.getFrom(), RANGE.getTo()))
                .thenReturn(List.of(new DailySendStat(LocalDate.of(2026, 1, 1), 10000, 9900)));
        when(sendingPlatformClient.getSendsByList(RANGE.getFrom(), RANGE.getTo())).thenReturn(List.of());

        // Act
        PartnerVolumeView view = resolver.viewFor(RANGE, Set.of("M77", "GLB", "IGN"), 1000, 10, 0);

        // Assert
        assertTrue(view.hasMatchingVolume());
        assertEquals(10000, view.getTotalSends());

        VolumeFigure media = view.forPartner("M77", 400, 4);
        assertEquals(600, media.getValue());
        assertEquals(VolumeSource.SEGMENT, media.getSource());

        assertEquals(300, view.forDataSet("glb_home", 100, 1).getValue());

        VolumeFigure ignite = view.forPartner("IGN", 100, 1);
        assertEquals(1000, ignite.getValue());
        assertEquals(VolumeSource.PROPORTIONAL_ESTIMATE, ignite.getSource());
        assertFalse(ignite.isExact());
    }

    @Test
    @DisplayName("List volume only yields estimates, with the ESP total when no send totals resolve")
    void viewFor_ListVolumeEstimatesOnly() {
        when(exportStrategy.resolve(RANGE)).thenReturn(Optional.empty());
        when(segmentStrategy.resolve(RANGE))
                .thenReturn(
                        Optional.of(
                                VolumeResult.builder()
                                        .sendsByDataSet(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L))
                                        .source(VolumeSource.LIST)
                                        .perPartnerUsable(false)
                                        .build()));
        when(sendingPlatformClient.getDailyStats(RANGE.getFrom(), RANGE.getTo())).thenReturn(List.of());
        when(sendingPlatformClient.getSendsByList(RANGE.getFrom(), RANGE.getTo())).thenReturn(List.of());

        PartnerVolumeView view = resolver.viewFor(RANGE, Set.of("M77"), 0, 20, 4000);

        assertFalse(view.hasMatchingVolume());
        assertEquals(4000, view.getTotalSends());
        VolumeFigure figure = view.forPartner("M77", 0, 5);
        assertEquals(1000, figure.getValue());
        assertEquals(VolumeSource.PROPORTIONAL_ESTIMATE, figure.getSource());
    }

    private static VolumeResult exportSnapshot(Instant resolvedAt) {
        return VolumeResult.builder()
                .sendsByDataSet(Map.of("M77_WIT", 600L, "GLB_HOME", 300L, "SCO_X", 100L))
                .source(VolumeSource.CONTACT_EXPORT)
                .exact(true)
                .resolvedAt(resolvedAt)
                .build();
    }

    @Test
    @DisplayName("An exact snapshot is cached only for what is left of its TTL since it was resolved")
    void ttlFor_ExactCountsFromResolvedAt() {
        VolumeResult snapshot = exportSnapshot(CLOCK.instant().minus(Duration.ofHours(20)));

        assertEquals(Duration.ofHours(4), resolver.ttlFor(snapshot));
        assertEquals(Duration.ofMinutes(30), resolver.ttlFor(segmentVolume(Map.of("M77_WIT", 1L))));
    }

    @Test
    @DisplayName("An exact snapshot past its TTL is served once but not cached")
    void resolve_ExpiredExactSnapshotNotCached() {
        VolumeResult snapshot = exportSnapshot(CLOCK.instant().minus(Duration.ofHours(25)));
        when(exportStrategy.resolve(RANGE)).thenReturn(Optional.of(snapshot));

        assertSame(snapshot, resolver.resolve(RANGE));
        resolver.resolve(RANGE);

        verify(exportStrategy, times(2)).resolve(RANGE);
    }
}
