package com.mailattribution.client.tracking;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregated totals of one entity-report row or of the whole report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportMetrics {
    private long totalClick;
    private long conversions;
    @Builder.Default private BigDecimal revenue = BigDecimal.ZERO;
    @Builder.Default private BigDecimal payout = BigDecimal.ZERO;

    public static ReportMetrics empty() {
        return ReportMetrics.builder().build();
    }
}
