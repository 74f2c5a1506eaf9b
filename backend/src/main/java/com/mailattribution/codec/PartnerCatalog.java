package com.mailattribution.codec;

import com.mailattribution.config.AppProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Resolves data-set codes to data-partner groups.
 *
 * <p>Resolution order: full-code override table, then the prefix before the first underscore
 * against the external partner table, then the internal default partner.
 */
@Component
public class PartnerCatalog {

    private final Map<String, String> partnerNames;
    private final Map<String, String> overrides;
    private final PartnerGroup defaultPartner;

    public PartnerCatalog(AppProperties appProperties) {
        this(
                appProperties.getCatalog().getPartners(),
                appProperties.getCatalog().getDataSetOverrides(),
                new PartnerGroup(
                        appProperties.getCatalog().getDefaultPartnerCode(),
                        appProperties.getCatalog().getDefaultPartnerName()));
    }

    public PartnerCatalog(
            Map<String, String> partnerNames,
            Map<String, String> overrides,
            PartnerGroup defaultPartner) {
        this.partnerNames = upperKeys(partnerNames);
        this.overrides = upperKeys(overrides);
        this.defaultPartner = defaultPartner;
    }

    public PartnerGroup resolve(String dataSetCode) {
        String upper = dataSetCode.toUpperCase(Locale.ROOT);

        String overrideKey = overrides.get(upper);
        if (overrideKey != null) {
            String key = overrideKey.toUpperCase(Locale.ROOT);
            return new PartnerGroup(key, nameOf(key));
        }

        String prefix = upper;
        int idx = upper.indexOf('_');
        if (idx > 0) {
            prefix = upper.substring(0, idx);
        }
        String name = partnerNames.get(prefix);
        if (name != null) {
            return new PartnerGroup(prefix, name);
        }
        return defaultPartner;
    }

    /** Display name for a group key; the key itself when unknown. */
    public String nameOf(String groupKey) {
        String upper = groupKey.toUpperCase(Locale.ROOT);
        if (upper.equals(defaultPartner.getKey())) {
            return defaultPartner.getName();
        }
        return partnerNames.getOrDefault(upper, groupKey);
    }

    public boolean isExternalPrefix(String prefix) {
        return prefix != null && partnerNames.containsKey(prefix.toUpperCase(Locale.ROOT));
    }

    public PartnerGroup getDefaultPartner() {
        return defaultPartner;
    }

    private static Map<String, String> upperKeys(Map<String, String> source) {
        Map<String, String> map = new LinkedHashMap<>();
        source.forEach((k, v) -> map.put(k.toUpperCase(Locale.ROOT), v));
        return Collections.unmodifiableMap(map);
    }
}
