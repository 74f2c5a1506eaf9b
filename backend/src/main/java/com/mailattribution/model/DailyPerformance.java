package com.mailattribution.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class DailyPerformance {
    LocalDate date;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal payout;
    BigDecimal conversionRate;
    BigDecimal epc;
}
