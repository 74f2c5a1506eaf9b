package com.mailattribution.monitoring;

import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.ReconciliationReport;
import com.mailattribution.util.MoneyUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/** Collection-cycle, reconciliation and volume metrics. */
@Component
public class AttributionMetrics {

    private final MeterRegistry meterRegistry;

    // Gauges
    private final AtomicReference<BigDecimal> reconciliationGap = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> reconciliationResidual =
            new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> authoritativeRevenue =
            new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicInteger campaignCount = new AtomicInteger();
    private final AtomicInteger conversionCount = new AtomicInteger();

    // Timers
    private final Timer cycleTimer;

    public AttributionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("attribution.reconciliation.gap", reconciliationGap, r -> r.get().doubleValue())
                .description("Authoritative offer revenue minus conversion-based ESP revenue")
                .register(meterRegistry);
        Gauge.builder(
                        "attribution.reconciliation.residual",
                        reconciliationResidual,
                        r -> r.get().doubleValue())
                .description("Residual added by the final reconciliation step")
                .register(meterRegistry);
        Gauge.builder("attribution.revenue.authoritative", authoritativeRevenue, r -> r.get().doubleValue())
                .description("Total offer revenue of the current snapshot")
                .register(meterRegistry);
        Gauge.builder("attribution.snapshot.campaigns", campaignCount, AtomicInteger::get)
                .description("Campaigns in the current snapshot")
                .register(meterRegistry);
        Gauge.builder("attribution.snapshot.conversions", conversionCount, AtomicInteger::get)
                .description("Conversions held for the lookback window")
                .register(meterRegistry);

        this.cycleTimer =
                Timer.builder("attribution.cycle.duration")
                        .description("Time taken by one tracking collection cycle")
                        .register(meterRegistry);
    }

    public void recordCycle(String mode, String outcome) {
        Counter.builder("attribution.cycle")
                .description("Tracking collection cycles")
                .tag("mode", mode)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordReportFailure(String report) {
        Counter.builder("attribution.report.failure")
                .description("Entity reports that failed after their retry")
                .tag("report", report)
                .register(meterRegistry)
                .increment();
    }

    public void recordSendingSync(String outcome) {
        Counter.builder("attribution.sending.sync")
                .description("Sending-platform sync runs")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordSnapshot(AttributionSnapshot snapshot, int conversions) {
        ReconciliationReport report = snapshot.getReconciliation();
        if (report != null) {
            reconciliationGap.set(MoneyUtils.nullToZero(report.getGap()));
            reconciliationResidual.set(MoneyUtils.nullToZero(report.getResidual()));
            authoritativeRevenue.set(MoneyUtils.nullToZero(report.getAuthoritativeTotal()));
        }
        campaignCount.set(snapshot.getCampaigns().size());
        conversionCount.set(conversions);
    }

    public Timer.Sample startCycleTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCycleTime(Timer.Sample sample) {
        sample.stop(cycleTimer);
    }
}
