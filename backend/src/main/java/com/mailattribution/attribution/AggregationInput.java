package com.mailattribution.attribution;

import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Raw slices and cached reports for one aggregation. Reports may be null when they were never
 * fetched; raw clicks and conversions are then used instead.
 */
@Value
@Builder
public class AggregationInput {
    EntityReport dateReport;
    EntityReport offerReport;
    EntityReport sub1Report;
    @Builder.Default List<Click> clicks = List.of();
    @Builder.Default List<Conversion> conversions = List.of();
    LocalDate today;
    ZoneId zoneId;
}
