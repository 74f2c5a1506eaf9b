package com.mailattribution.client.sending;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Request for an asynchronous contact-activity report. The report lists contacts whose {@code
 * filterField} is not empty, with the selected fields, for the given window.
 */
@Value
@Builder
public class ContactActivityRequest {
    String title;
    @Singular List<String> selectedFields;
    String filterField;
    Instant fromDate;
    Instant toDate;
}
