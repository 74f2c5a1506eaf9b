package com.mailattribution.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A conversion with its sub1 and sub2 identifiers parsed.
 *
 * <p>{@code dataSetCode} and {@code dataPartner} are carried forward from sub2 so partner
 * attribution still works when a later sub2 fails to parse.
 */
@Value
@Builder(toBuilder = true)
public class Conversion {
    String conversionId;
    String transactionId;
    String clickId;
    String offerId;
    String offerName;
    String status;
    BigDecimal revenue;
    BigDecimal payout;
    String sub1;
    String sub2;
    String sub3;
    ZonedDateTime conversionTime;
    ZonedDateTime clickTime;

    // Parsed from sub1
    String propertyCode;
    String propertyName;
    String mailingId;
    String parsedOfferId;

    // Parsed from sub2
    String dataSetCode;
    String dataPartner;

    public LocalDate getConversionDate() {
        return conversionTime == null ? null : conversionTime.toLocalDate();
    }
}
