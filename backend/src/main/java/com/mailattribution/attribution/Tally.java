package com.mailattribution.attribution;

import com.mailattribution.client.tracking.ReportMetrics;
import com.mailattribution.model.Conversion;
import com.mailattribution.util.MoneyUtils;
import java.math.BigDecimal;
import lombok.Getter;

/** Mutable click, conversion and money counters used while aggregating one build. */
@Getter
class Tally {

    private long clicks;
    private long conversions;
    private BigDecimal revenue = BigDecimal.ZERO;
    private BigDecimal payout = BigDecimal.ZERO;

    void addClick() {
        clicks++;
    }

    void addConversion(Conversion conversion) {
        conversions++;
        revenue = revenue.add(MoneyUtils.nullToZero(conversion.getRevenue()));
        payout = payout.add(MoneyUtils.nullToZero(conversion.getPayout()));
    }

    void add(ReportMetrics metrics) {
        if (metrics == null) {
            return;
        }
        clicks += metrics.getTotalClick();
        conversions += metrics.getConversions();
        revenue = revenue.add(MoneyUtils.nullToZero(metrics.getRevenue()));
        payout = payout.add(MoneyUtils.nullToZero(metrics.getPayout()));
    }

    void add(Tally other) {
        clicks += other.clicks;
        conversions += other.conversions;
        revenue = revenue.add(other.revenue);
        payout = payout.add(other.payout);
    }

    void subtract(Tally other) {
        clicks -= other.clicks;
        conversions -= other.conversions;
        revenue = revenue.subtract(other.revenue);
        payout = payout.subtract(other.payout);
    }

    boolean isEmpty() {
        return clicks == 0 && conversions == 0 && revenue.signum() == 0 && payout.signum() == 0;
    }

    BigDecimal conversionRate() {
        return MoneyUtils.ratio(conversions, clicks);
    }

    BigDecimal epc() {
        return MoneyUtils.per(revenue, clicks);
    }
}
