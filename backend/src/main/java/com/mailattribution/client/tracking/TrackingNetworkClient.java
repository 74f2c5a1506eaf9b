package com.mailattribution.client.tracking;

import com.mailattribution.exception.UpstreamApiException;
import java.time.LocalDate;
import java.util.List;

/**
 * Port to the affiliate-tracking network. Date ranges are inclusive and expressed in the
 * network's reporting time zone.
 *
 * <p>Implementations throw {@link UpstreamApiException} (or its {@code RateLimitException}
 * subtype) for failed calls.
 */
public interface TrackingNetworkClient {

    List<ClickRecord> getClicks(LocalDate from, LocalDate to);

    ConversionPage getConversions(
            LocalDate from, LocalDate to, boolean approvedOnly, int page, int pageSize);

    EntityReport getEntityReport(LocalDate from, LocalDate to, List<ReportDimension> dimensions);
}
