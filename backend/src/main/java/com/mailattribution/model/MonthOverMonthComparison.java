package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Data-partner conversions this calendar month against the previous one. */
@Value
@Builder(toBuilder = true)
public class MonthOverMonthComparison {
    PeriodSummary currentMonth;
    PeriodSummary previousMonth;
    BigDecimal revenueChangePct;
    BigDecimal conversionsChangePct;
    BigDecimal clicksChangePct;
}
