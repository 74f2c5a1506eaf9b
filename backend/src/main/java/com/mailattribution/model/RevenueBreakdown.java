package com.mailattribution.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** CPM against non-CPM revenue, with a daily trend from conversions. */
@Value
@Builder
public class RevenueBreakdown {
    RevenueTypeTotals cpm;
    RevenueTypeTotals nonCpm;
    List<DailyBreakdown> dailyTrend;

    @Value
    @Builder
    public static class RevenueTypeTotals {
        int offerCount;
        long clicks;
        long conversions;
        BigDecimal revenue;
        BigDecimal payout;
        BigDecimal percentage;
    }

    @Value
    public static class DailyBreakdown {
        LocalDate date;
        BigDecimal cpmRevenue;
        BigDecimal nonCpmRevenue;
    }
}
