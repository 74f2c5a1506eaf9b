package com.mailattribution.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Revenue of one mailing, keyed by mailing id, optionally joined with sending-platform stats. */
@Value
@Builder(toBuilder = true)
public class CampaignRevenue {
    String mailingId;
    String campaignName;
    String propertyCode;
    String propertyName;
    String offerId;
    String offerName;
    long clicks;
    long conversions;
    BigDecimal revenue;
    BigDecimal payout;
    BigDecimal conversionRate;
    BigDecimal epc;

    // Sending-platform enrichment
    boolean platformLinked;
    long audienceSize;
    long sent;
    long delivered;
    long opens;
    long uniqueOpens;
    long emailClicks;
    String sendingDomain;
    String espName;
    String espConnectionId;
    BigDecimal ecpm;
    BigDecimal rpm;
    BigDecimal revenuePerOpen;
}
