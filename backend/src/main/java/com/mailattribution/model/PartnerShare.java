package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A partner's share of one offer in the offer-centric view. */
@Value
@Builder(toBuilder = true)
public class PartnerShare {
    String partnerPrefix;
    String partnerName;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal clickShare;
}
