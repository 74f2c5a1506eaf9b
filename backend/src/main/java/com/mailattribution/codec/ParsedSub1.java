package com.mailattribution.codec;

import lombok.Builder;
import lombok.Value;

/**
 * Fields recovered from a sub1 tag such as {@code TDIH_407_3926_01262026_3219537162}.
 *
 * <p>Every field except {@code raw} may be null. {@code date} keeps the raw mmddyyyy token.
 */
@Value
@Builder
public class ParsedSub1 {
    String raw;
    String propertyCode;
    String propertyName;
    String offerId;
    String date;
    String mailingId;

    public boolean hasMailingId() {
        return mailingId != null && !mailingId.isEmpty();
    }

    public boolean hasPropertyCode() {
        return propertyCode != null && !propertyCode.isEmpty();
    }
}
