package com.mailattribution.model;

import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.Value;

/** A click with its sub1 and sub2 identifiers parsed. */
@Value
@Builder(toBuilder = true)
public class Click {
    String clickId;
    String offerId;
    String offerName;
    String sub1;
    String sub2;
    ZonedDateTime timestamp;
    String propertyCode;
    String propertyName;
    String mailingId;
    String parsedOfferId;
    String dataSetCode;
    String dataPartner;
}
