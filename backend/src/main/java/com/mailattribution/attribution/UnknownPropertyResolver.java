package com.mailattribution.attribution;

import java.util.Collection;
import java.util.Map;

/** Resolves mailing ids whose sub1 carries an uncatalogued property code to a known property. */
public interface UnknownPropertyResolver {

    /**
     * @return mailing id to catalogued property code, for the ids that could be resolved
     */
    Map<String, String> resolvePropertyCodes(Collection<String> mailingIds);
}
