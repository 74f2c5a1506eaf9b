package com.mailattribution.client.sending;

import lombok.Builder;
import lombok.Value;

/** Send totals grouped by segment or by list; {@code id} is the segment or list id. */
@Value
@Builder
public class SendReportRow {
    String id;
    String name;
    long sent;
    long delivered;
}
