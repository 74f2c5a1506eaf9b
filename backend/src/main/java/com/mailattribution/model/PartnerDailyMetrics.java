package com.mailattribution.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PartnerDailyMetrics {
    LocalDate date;
    long conversions;
    BigDecimal revenue;
}
