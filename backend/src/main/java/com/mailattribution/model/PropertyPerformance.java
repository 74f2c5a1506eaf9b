package com.mailattribution.model;

import com.mailattribution.codec.Sub1Reason;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Totals per content property, plus the synthetic Unattributed and Unknown Property rows. */
@Value
@Builder(toBuilder = true)
public class PropertyPerformance {
    String propertyCode;
    String propertyName;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal payout;
    BigDecimal conversionRate;
    BigDecimal epc;
    int uniqueOffers;
    boolean unattributed;
    Sub1Reason unattributedReason;
}
