package com.mailattribution.client.tracking;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EntityReportRow {
    @Singular List<EntityColumn> columns;
    ReportMetrics reporting;

    public Optional<EntityColumn> column(ReportDimension dimension) {
        return columns.stream()
                .filter(c -> dimension.getColumnType().equals(c.getColumnType()))
                .findFirst();
    }

    /** Label of the given dimension, or an empty string when the row lacks it. */
    public String label(ReportDimension dimension) {
        return column(dimension).map(EntityColumn::getLabel).filter(l -> l != null).orElse("");
    }

    /** Id of the given dimension, or an empty string when the row lacks it. */
    public String id(ReportDimension dimension) {
        return column(dimension).map(EntityColumn::getId).filter(i -> i != null).orElse("");
    }
}
