package com.mailattribution.codec;

import java.util.Locale;

/** Offer payout model, detected from the offer name. */
public enum OfferType {
    CPM,
    CPA,
    CPL,
    CPS,
    CPC,
    CPV,
    OTHER;

    public static OfferType fromOfferName(String offerName) {
        if (offerName == null) {
            return OTHER;
        }
        String upper = offerName.toUpperCase(Locale.ROOT);
        for (OfferType type : values()) {
            if (type != OTHER && upper.contains(type.name())) {
                return type;
            }
        }
        return OTHER;
    }

    /** CPM offers pay per thousand sends; anything else is treated as conversion based. */
    public static boolean isCpm(String offerName) {
        return offerName != null && offerName.toUpperCase(Locale.ROOT).contains("CPM");
    }
}
