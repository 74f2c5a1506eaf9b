package com.mailattribution.attribution;

import com.mailattribution.model.CpmAttributionSummary;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
public class CpmAttribution {
    List<PartnerOfferShare> shares;
    CpmAttributionSummary summary;

    /** One partner's click-share portion of one CPM offer. */
    @Value
    @Builder
    public static class PartnerOfferShare {
        String partnerKey;
        String partnerName;
        String offerId;
        String offerName;
        long clicks;
        BigDecimal revenue;
    }
}
