package com.mailattribution.client.tracking;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** An aggregated report from the tracking network, grouped by one or more dimensions. */
@Value
@Builder
public class EntityReport {
    @Singular("row") List<EntityReportRow> table;
    @Builder.Default ReportMetrics summary = ReportMetrics.empty();

    public boolean isEmpty() {
        return table.isEmpty();
    }

    public static EntityReport empty() {
        return EntityReport.builder().build();
    }
}
