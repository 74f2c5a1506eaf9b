package com.mailattribution.state;

import com.mailattribution.cache.DateRange;
import com.mailattribution.client.tracking.EntityReport;
import com.mailattribution.model.Click;
import com.mailattribution.model.Conversion;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Raw tracking-network data behind the current snapshot. Reports are null until first fetched
 * successfully; a failed refetch keeps the previous report.
 */
@Value
@Builder(toBuilder = true)
public class TrackingData {
    EntityReport dateReport;
    EntityReport offerReport;
    EntityReport sub1Report;
    EntityReport sub2Report;
    EntityReport offerPartnerReport;
    @Builder.Default List<Conversion> conversions = List.of();
    @Builder.Default List<Click> clicks = List.of();
    DateRange window;
    Instant fetchedAt;

    public static TrackingData empty() {
        return TrackingData.builder().build();
    }

    public boolean isFetched() {
        return fetchedAt != null;
    }
}
