package com.mailattribution.attribution;

import com.mailattribution.config.AppProperties;
import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.Conversion;
import com.mailattribution.model.RevenueBreakdown;
import com.mailattribution.state.TrackingData;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds an {@link AttributionSnapshot} from one collection cycle: aggregation, campaign
 * enrichment, ESP reconciliation and the CPM breakdown. The build reads only its input, so the
 * same data always yields the same snapshot apart from {@code builtAt}.
 */
@Slf4j
@Component
public class AttributionEngine {

    private final CampaignAggregator campaignAggregator;
    private final CampaignEnricher campaignEnricher;
    private final EspRevenueReconciler espRevenueReconciler;
    private final RevenueBreakdownCalculator revenueBreakdownCalculator;
    private final Clock clock;
    private final ZoneId zoneId;
    private final int recentConversionsLimit;

    public AttributionEngine(
            CampaignAggregator campaignAggregator,
            CampaignEnricher campaignEnricher,
            EspRevenueReconciler espRevenueReconciler,
            RevenueBreakdownCalculator revenueBreakdownCalculator,
            AppProperties appProperties,
            Clock clock) {
        this.campaignAggregator = campaignAggregator;
        this.campaignEnricher = campaignEnricher;
        this.espRevenueReconciler = espRevenueReconciler;
        this.revenueBreakdownCalculator = revenueBreakdownCalculator;
        this.clock = clock;
        this.zoneId = ZoneId.of(appProperties.getTracking().getZoneId());
        this.recentConversionsLimit = appProperties.getTracking().getRecentConversionsLimit();
    }

    public AttributionSnapshot build(TrackingData data, LocalDate today) {
        AggregationResult aggregation =
                campaignAggregator.aggregate(
                        AggregationInput.builder()
                                .dateReport(data.getDateReport())
                                .offerReport(data.getOfferReport())
                                .sub1Report(data.getSub1Report())
                                .clicks(data.getClicks())
                                .conversions(data.getConversions())
                                .today(today)
                                .zoneId(zoneId)
                                .build());

        List<CampaignRevenue> campaigns = campaignEnricher.enrich(aggregation.getCampaigns());

        EspReconciliation esp =
                espRevenueReconciler.reconcile(
                        campaigns, aggregation.getOffers(), campaignEnricher.getPlatformCampaigns());

        RevenueBreakdown breakdown =
                revenueBreakdownCalculator.calculate(aggregation.getOffers(), data.getConversions());

        log.info(
                "Attribution built: {} campaigns, {} properties, {} offers, reconciliation {} (gap {})",
                campaigns.size(),
                aggregation.getProperties().size(),
                aggregation.getOffers().size(),
                esp.getReport().getMethod(),
                esp.getReport().getGap());

        return AttributionSnapshot.builder()
                .campaigns(campaigns)
                .properties(aggregation.getProperties())
                .offers(aggregation.getOffers())
                .daily(aggregation.getDaily())
                .espRevenue(esp.getEntries())
                .revenueBreakdown(breakdown)
                .reconciliation(esp.getReport())
                .unattributedByReason(aggregation.getUnattributedByReason())
                .today(aggregation.getToday())
                .recentConversions(recentConversions(data.getConversions()))
                .builtAt(clock.instant())
                .build();
    }

    /** Most recent conversions first; conversions without a timestamp sort last. */
    List<Conversion> recentConversions(List<Conversion> conversions) {
        return conversions.stream()
                .sorted(
                        Comparator.comparing(
                                        Conversion::getConversionTime,
                                        Comparator.nullsFirst(
                                                Comparator.comparing(ZonedDateTime::toInstant)))
                                .reversed()
                                .thenComparing(
                                        Conversion::getConversionId,
                                        Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(recentConversionsLimit)
                .collect(Collectors.toList());
    }
}
