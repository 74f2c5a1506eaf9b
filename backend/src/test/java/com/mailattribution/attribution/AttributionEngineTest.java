package com.mailattribution.attribution;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.mailattribution.TestFixtures;
import com.mailattribution.client.sending.CampaignMetadata;
import com.mailattribution.client.sending.SendingPlatformClient;
import com.mailattribution.codec.IdentifierCodec;
import com.mailattribution.config.AppProperties;
import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.ReconciliationMethod;
import com.mailattribution.state.TrackingData;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AttributionEngineTest {

    private static final ZoneId ZONE = ZoneId.of(TestFixtures.ZONE);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-27T20:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 27);

    @Mock private SendingPlatformClient sendingPlatformClient;

    private AppProperties appProperties;
    private CampaignEnricher enricher;
    private AttributionEngine engine;

    @BeforeEach
    void setUp() {
        appProperties = TestFixtures.appProperties();
        appProperties.getTracking().setRecentConversionsLimit(3);
        IdentifierCodec codec = TestFixtures.identifierCodec();
        enricher =
                new CampaignEnricher(
                        sendingPlatformClient,
                        TestFixtures.directCalls("sending-platform"),
                        codec,
                        appProperties,
                        CLOCK);
        engine =
                new AttributionEngine(
                        new CampaignAggregator(codec, enricher),
                        enricher,
                        new EspRevenueReconciler(codec),
                        new RevenueBreakdownCalculator(),
                        appProperties,
                        CLOCK);
    }

    private static Conversion conversion(String id, String sub1, String revenue, LocalDate day, int hour) {
        return Conversion.builder()
                .conversionId(id)
                .offerId("407")
                .offerName("Fidelity Life CPA")
                .sub1(sub1)
                .revenue(new BigDecimal(revenue))
                .payout(BigDecimal.ZERO)
                .conversionTime(day == null ? null : day.atTime(hour, 0).atZone(ZONE))
                .build();
    }

    @Test
    @DisplayName("A snapshot joins enriched campaigns with ESP revenue reconciled to the offer total")
    void build_ReconciledSnapshot() {
        // Arrange
        enricher.cacheCampaigns(
                List.of(
                        CampaignMetadata.builder()
                                .mailingId("3219537162")
                                .name("01262026_TDIH_407_FidelityLife_OPENERS")
                                .espName("SparkPost Enterprise")
                                .sent(10_000)
                                .delivered(9_000)
                                .build()));
        when(sendingPlatformClient.getCampaign(anyString())).thenReturn(Optional.empty());
        TrackingData data =
                TrackingData.builder()
                        .conversions(
                                List.of(
                                        conversion("1", "TDIH_407_3926_01262026_3219537162", "100.00", TODAY, 9),
                                        conversion("2", "TDIH_407_3926_01262026_4400000001", "60.00", TODAY, 10),
                                        conversion("3", "", "40.00", TODAY, 11)))
                        .fetchedAt(CLOCK.instant())
                        .build();

        // Act
        AttributionSnapshot snapshot = engine.build(data, TODAY);

        // Assert
        assertEquals(2, snapshot.getCampaigns().size());
        assertTrue(snapshot.getCampaigns().get(0).isPlatformLinked());
        assertFalse(snapshot.getCampaigns().get(1).isPlatformLinked());

        assertEquals(0, new BigDecimal("200.00").compareTo(snapshot.getReconciliation().getAuthoritativeTotal()));
        assertEquals(ReconciliationMethod.OFFER_VOLUME_DISTRIBUTION, snapshot.getReconciliation().getMethod());
        assertEquals(1, snapshot.getEspRevenue().size());
        assertEquals("SparkPost", snapshot.getEspRevenue().get(0).getEspName());
        assertTrue(
                MoneyUtils.withinOneCent(
                        new BigDecimal("200.00"), snapshot.getEspRevenue().get(0).getRevenue()));

        assertEquals(3, snapshot.getToday().getConversions());
        assertEquals(0, new BigDecimal("100").compareTo(snapshot.getRevenueBreakdown().getNonCpm().getPercentage()));
        assertEquals(CLOCK.instant(), snapshot.getBuiltAt());
    }

    @Test
    @DisplayName("Recent conversions are newest first, undated last, and limited")
    void recentConversions() {
        List<Conversion> conversions = new ArrayList<>();
        conversions.add(conversion("a", "x", "1", null, 0));
        conversions.add(conversion("b", "x", "1", TODAY, 8));
        conversions.add(conversion("c", "x", "1", TODAY, 12));
        conversions.add(conversion("d", "x", "1", TODAY.minusDays(1), 23));

        List<String> ids =
                engine.recentConversions(conversions).stream()
                        .map(Conversion::getConversionId)
                        .collect(Collectors.toList());

        assertEquals(List.of("c", "b", "d"), ids);
    }

    @Test
    @DisplayName("Conversions at the same instant are ordered by id")
    void recentConversions_TieBreak() {
        List<String> ids =
                engine
                        .recentConversions(
                                List.of(
                                        conversion("z", "x", "1", TODAY, 8),
                                        conversion("m", "x", "1", TODAY, 8)))
                        .stream()
                        .map(Conversion::getConversionId)
                        .collect(Collectors.toList());

        assertEquals(List.of("m", "z"), ids);
    }
}
