package com.mailattribution.codec;

import lombok.Builder;
import lombok.Value;

/** Parts of a sending-platform campaign name: {@code [DATE]_[PROPERTY]_[OFFERID]_[NAME...]_[SEGMENT]}. */
@Value
@Builder
public class ParsedCampaignName {
    String date;
    String property;
    String offerId;
    String offerName;
    String segment;
}
