package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Partner totals for a labelled period. */
@Value
@Builder(toBuilder = true)
public class PeriodSummary {
    String label;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal cpaRevenue;
    BigDecimal cpmRevenue;
    long volume;
}
