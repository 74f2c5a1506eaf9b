package com.mailattribution.codec;

import com.mailattribution.config.AppProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Content properties (sending brands) keyed by their short upper-case code. */
@Component
public class PropertyCatalog {

    private final Map<String, String> namesByCode;

    public PropertyCatalog(AppProperties appProperties) {
        this(appProperties.getCatalog().getProperties());
    }

    public PropertyCatalog(Map<String, String> namesByCode) {
        Map<String, String> normalized = new LinkedHashMap<>();
        namesByCode.forEach((code, name) -> normalized.put(code.toUpperCase(Locale.ROOT), name));
        this.namesByCode = Collections.unmodifiableMap(normalized);
    }

    public boolean isKnown(String code) {
        return code != null && namesByCode.containsKey(code.toUpperCase(Locale.ROOT));
    }

    /** Returns the property name, or the code itself when the code is not catalogued. */
    public String nameOf(String code) {
        if (code == null) {
            return null;
        }
        return namesByCode.getOrDefault(code.toUpperCase(Locale.ROOT), code);
    }

    public Map<String, String> asMap() {
        return namesByCode;
    }
}
