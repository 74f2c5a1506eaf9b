package com.mailattribution.attribution;

import com.mailattribution.codec.Sub1Reason;
import com.mailattribution.model.CampaignRevenue;
import com.mailattribution.model.DailyPerformance;
import com.mailattribution.model.OfferPerformance;
import com.mailattribution.model.PropertyPerformance;
import com.mailattribution.model.TodaySummary;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AggregationResult {
    List<CampaignRevenue> campaigns;
    List<PropertyPerformance> properties;
    List<OfferPerformance> offers;
    List<DailyPerformance> daily;
    Map<Sub1Reason, PropertyPerformance> unattributedByReason;
    TodaySummary today;
    /** True when campaigns came from the sub1 report rather than raw clicks and conversions */
    boolean fromSub1Report;
    int resolvedUnknownProperties;
}
