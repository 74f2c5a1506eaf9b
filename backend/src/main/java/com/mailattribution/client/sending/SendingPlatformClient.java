package com.mailattribution.client.sending;

import com.mailattribution.exception.UpstreamApiException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Port to the email-sending platform. Date ranges are inclusive.
 *
 * <p>Implementations throw {@link UpstreamApiException} (or its {@code RateLimitException}
 * subtype) for failed calls.
 */
public interface SendingPlatformClient {

    /** Campaigns with their delivery statistics, scheduled inside the window. */
    List<CampaignMetadata> getCampaigns(LocalDate from, LocalDate to);

    Optional<CampaignMetadata> getCampaign(String mailingId);

    List<SendReportRow> getSendsBySegment(LocalDate from, LocalDate to);

    List<SendReportRow> getSendsByList(LocalDate from, LocalDate to);

    List<ListInfo> getLists();

    List<DailySendStat> getDailyStats(LocalDate from, LocalDate to);

    /** @return the platform's report id */
    String createContactActivityReport(ContactActivityRequest request);

    ContactActivityStatus getContactActivityStatus(String reportId);

    /** CSV export of a completed report. */
    byte[] exportContactActivityCsv(String reportId);

    void deleteContactActivityReport(String reportId);
}
