package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Daily performance rolled up to an ISO week ({@code 2026-W05}) or a month ({@code 2026-01}). */
@Value
@Builder
public class PeriodPerformance {
    public enum PeriodType {
        WEEKLY,
        MONTHLY
    }

    String period;
    PeriodType periodType;
    long totalClicks;
    long totalConversions;
    BigDecimal totalRevenue;
    BigDecimal totalPayout;
    BigDecimal conversionRate;
    BigDecimal epc;
}
