package com.mailattribution.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Data-partner analytics for one window. */
@Value
@Builder
public class DataPartnerAnalytics {
    LocalDate from;
    LocalDate to;
    List<DataPartnerPerformance> partners;
    PeriodSummary totals;
    MonthOverMonthComparison monthOverMonth;
    List<OfferPartnerBreakdown> cpmOffers;
    List<OfferPartnerBreakdown> cpaOffers;
    CpmAttributionSummary cpmAttribution;
    /** Total sends for the window across the sending platform */
    long totalSends;
    Instant computedAt;

    public static DataPartnerAnalytics empty(LocalDate from, LocalDate to, Instant computedAt) {
        return DataPartnerAnalytics.builder()
                .from(from)
                .to(to)
                .partners(List.of())
                .cpmOffers(List.of())
                .cpaOffers(List.of())
                .computedAt(computedAt)
                .build();
    }
}
