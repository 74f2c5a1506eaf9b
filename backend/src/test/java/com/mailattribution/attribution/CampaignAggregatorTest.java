package com.mailattribution.attribution;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

import com.mailattribution.TestFixtures;
import com.mailattribution.client.tracking.EntityColumn;
import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.client.tracking.EntityReportRow;
import com.mailattribution.client.tracking.ReportMetrics;
import com.mailattribution.codec.Sub1Reason;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.PropertyPerformance;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CampaignAggregatorTest {

    private static final ZoneId ZONE = ZoneId.of(TestFixtures.ZONE);
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 27);
    private static final String TAG = "TDIH_407_3926_01262026_3219537162";

    @Mock private UnknownPropertyResolver unknownPropertyResolver;

    private CampaignAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CampaignAggregator(TestFixtures.identifierCodec(), unknownPropertyResolver);
    }

    private static Click click(String id, String sub1) {
        return Click.builder()
                .clickId(id)
                .offerId("407")
                .sub1(sub1)
                .timestamp(ZonedDateTime.of(2026, 1, 26, 10, 0, 0, 0, ZONE))
                .build();
    }

    private static Conversion conversion(String id, String sub1, String revenue) {
        return Conversion.builder()
                .conversionId(id)
                .offerId("407")
                .offerName("Fidelity Life CPA")
                .sub1(sub1)
                .revenue(new BigDecimal(revenue))
                .payout(BigDecimal.ZERO)
                .conversionTime(ZonedDateTime.of(2026, 1, 26, 12, 0, 0, 0, ZONE))
                .build();
    }

    private AggregationInput input(List<Click> clicks, List<Conversion> conversions) {
        return AggregationInput.builder()
                .clicks(clicks)
                .conversions(conversions)
                .today(TODAY)
                .zoneId(ZONE)
                .build();
    }

    @Test
    @DisplayName("Raw clicks and conversions roll up into a campaign with rate and EPC")
    void aggregate_FromRecords() {
        // Arrange
        AggregationInput input =
                input(List.of(click("c1", TAG), click("c2", TAG)), List.of(conversion("v1", TAG, "225.00")));

        // Act
        AggregationResult result = aggregator.aggregate(input);

        // Assert
        assertFalse(result.isFromSub1Report());
        assertEquals(1, result.getCampaigns().size());
        CampaignRevenue campaign = result.getCampaigns().get(0);
        assertEquals("3219537162", campaign.getMailingId());
        assertEquals("TDIH", campaign.getPropertyCode());
        assertEquals("Fidelity Life CPA", campaign.getOfferName());
        assertEquals(2, campaign.getClicks());
        assertEquals(1, campaign.getConversions());
        assertEquals(0, new BigDecimal("0.5").compareTo(campaign.getConversionRate()));
        assertEquals(0, new BigDecimal("112.5").compareTo(campaign.getEpc()));

        assertEquals(1, result.getProperties().size());
        PropertyPerformance property = result.getProperties().get(0);
        assertEquals("thisdayinhistory.co", property.getPropertyName());
        assertFalse(property.isUnattributed());

        assertEquals(1, result.getDaily().size());
        assertEquals(LocalDate.of(2026, 1, 26), result.getDaily().get(0).getDate());
        assertEquals(0, result.getToday().getClicks());
    }

    @Test
    @DisplayName("Aggregating the same input twice yields identical results")
    void aggregate_Idempotent() {
        AggregationInput input =
                input(
                        List.of(click("c1", TAG), click("c2", ""), click("c3", TAG)),
                        List.of(conversion("v1", TAG, "225.00"), conversion("v2", "garbage", "10.00")));

        assertEquals(aggregator.aggregate(input), aggregator.aggregate(input));
    }

    @Test
    @DisplayName("Untagged revenue lands in one Unattributed row labelled with its dominant reason")
    void aggregate_UnattributedBuckets() {
        // Arrange
        AggregationInput input =
                input(
                        List.of(click("c1", ""), click("c2", TAG)),
                        List.of(
                                conversion("v1", "", "50.00"),
                                conversion("v2", "garbage", "80.00"),
                                conversion("v3", TAG, "20.00")));

        // Act
        AggregationResult result = aggregator.aggregate(input);

        // Assert
        PropertyPerformance unattributed =
                result.getProperties().stream()
                        .filter(p -> CampaignAggregator.UNATTRIBUTED_CODE.equals(p.getPropertyCode()))
                        .findFirst()
                        .orElseThrow();
        assertTrue(unattributed.isUnattributed());
        assertEquals(Sub1Reason.PARSE_ERROR, unattributed.getUnattributedReason());
        assertEquals(0, new BigDecimal("130.00").compareTo(unattributed.getRevenue()));
        assertEquals(2, unattributed.getConversions());
        assertEquals(1, unattributed.getClicks());

        Map<Sub1Reason, PropertyPerformance> byReason = result.getUnattributedByReason();
        assertEquals(0, new BigDecimal("50.00").compareTo(byReason.get(Sub1Reason.EMPTY_TAG).getRevenue()));
        assertEquals(0, new BigDecimal("80.00").compareTo(byReason.get(Sub1Reason.PARSE_ERROR).getRevenue()));

        // Nothing dropped
        BigDecimal total =
                result.getProperties().stream()
                        .map(PropertyPerformance::getRevenue)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, new BigDecimal("150.00").compareTo(total));
        assertEquals(CampaignAggregator.UNATTRIBUTED_CODE, result.getProperties().get(0).getPropertyCode());
    }

    @Test
    @DisplayName("Unknown-property campaigns move to the property their platform campaign names")
    void aggregate_ResolvesUnknownProperty() {
        // Arrange
        String unknownTag = "ZZZ_407_01262026_3219537162";
        when(unknownPropertyResolver.resolvePropertyCodes(anyCollection()))
                .thenReturn(Map.of("3219537162", "HRO"));

        // Act
        AggregationResult result =
                aggregator.aggregate(input(List.of(), List.of(conversion("v1", unknownTag, "100.00"))));

        // Assert
        assertEquals(1, result.getResolvedUnknownProperties());
        assertEquals(1, result.getProperties().size());
        assertEquals("HRO", result.getProperties().get(0).getPropertyCode());
        assertEquals("HRO", result.getCampaigns().get(0).getPropertyCode());
        assertFalse(result.getUnattributedByReason().containsKey(Sub1Reason.UNKNOWN_PROPERTY));
    }

    @Test
    @DisplayName("Unresolved unknown-property revenue is reported as Unknown Property")
    void aggregate_UnresolvedUnknownProperty() {
        when(unknownPropertyResolver.resolvePropertyCodes(anyCollection())).thenReturn(Map.of());

        AggregationResult result =
                aggregator.aggregate(
                        input(List.of(), List.of(conversion("v1", "ZZZ_407_01262026_3219537162", "100.00"))));

        assertEquals(0, result.getResolvedUnknownProperties());
        PropertyPerformance row = result.getProperties().get(0);
        assertEquals(CampaignAggregator.UNKNOWN_PROPERTY_CODE, row.getPropertyCode());
        assertEquals(Sub1Reason.UNKNOWN_PROPERTY, row.getUnattributedReason());
    }

    @Test
    @DisplayName("The sub1 report is preferred over raw records for campaigns")
    void aggregate_PrefersSub1Report() {
        // Arrange
        EntityReport sub1Report =
                EntityReport.builder()
                        .row(
                                EntityReportRow.builder()
                                        .column(new EntityColumn("sub1", TAG, TAG))
                                        .reporting(
                                                ReportMetrics.builder()
                                                        .totalClick(10)
                                                        .conversions(2)
                                                        .revenue(new BigDecimal("300.00"))
                                                        .build())
                                        .build())
                        .build();
        AggregationInput input =
                AggregationInput.builder()
                        .sub1Report(sub1Report)
                        .clicks(List.of(click("c1", TAG)))
                        .conversions(List.of(conversion("v1", TAG, "225.00")))
                        .today(TODAY)
                        .zoneId(ZONE)
                        .build();

        // Act
        AggregationResult result = aggregator.aggregate(input);

        // Assert
        assertTrue(result.isFromSub1Report());
        CampaignRevenue campaign = result.getCampaigns().get(0);
        assertEquals(10, campaign.getClicks());
        assertEquals(0, new BigDecimal("300.00").compareTo(campaign.getRevenue()));
        assertEquals(0, new BigDecimal("30").compareTo(campaign.getEpc()));
    }
}
