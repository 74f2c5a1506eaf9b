package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Revenue attributed to one sending service provider. */
@Value
@Builder(toBuilder = true)
public class EspRevenuePerformance {
    String espName;
    int campaignCount;
    long totalSent;
    long totalDelivered;
    long totalOpens;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal payout;
    BigDecimal percentage;
    BigDecimal avgEcpm;
    BigDecimal conversionRate;
    BigDecimal epc;
}
