package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Result of reconciling ESP revenue against the authoritative offer-level total.
 *
 * <p>{@code residual} is what the final rounding step moved; {@code finalAttributed} equals
 * {@code authoritativeTotal} within one cent whenever offer totals were available.
 */
@Value
@Builder
public class ReconciliationReport {
    BigDecimal authoritativeTotal;
    BigDecimal conversionBasedTotal;
    BigDecimal gap;
    ReconciliationMethod method;
    BigDecimal residual;
    BigDecimal finalAttributed;

    public static ReconciliationReport empty() {
        return ReconciliationReport.builder()
                .authoritativeTotal(BigDecimal.ZERO)
                .conversionBasedTotal(BigDecimal.ZERO)
                .gap(BigDecimal.ZERO)
                .method(ReconciliationMethod.NONE)
                .residual(BigDecimal.ZERO)
                .finalAttributed(BigDecimal.ZERO)
                .build();
    }
}
