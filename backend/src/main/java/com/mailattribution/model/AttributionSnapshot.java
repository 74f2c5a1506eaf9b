package com.mailattribution.model;

import com.mailattribution.codec.Sub1Reason;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the read accessors serve, rebuilt each collection cycle and published as one
 * immutable pointer.
 */
@Value
@Builder(toBuilder = true)
public class AttributionSnapshot {
    List<CampaignRevenue> campaigns;
    List<PropertyPerformance> properties;
    List<OfferPerformance> offers;
    List<DailyPerformance> daily;
    List<EspRevenuePerformance> espRevenue;
    RevenueBreakdown revenueBreakdown;
    ReconciliationReport reconciliation;
    /** Revenue per unattributed reason, before the untagged reasons are folded together */
    Map<Sub1Reason, PropertyPerformance> unattributedByReason;
    TodaySummary today;
    List<Conversion> recentConversions;
    Instant builtAt;

    public static AttributionSnapshot empty() {
        return AttributionSnapshot.builder()
                .campaigns(List.of())
                .properties(List.of())
                .offers(List.of())
                .daily(List.of())
                .espRevenue(List.of())
                .reconciliation(ReconciliationReport.empty())
                .unattributedByReason(Map.of())
                .recentConversions(List.of())
                .build();
    }
}
