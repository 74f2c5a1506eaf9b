package com.mailattribution.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Application Configuration Properties */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid private Tracking tracking = new Tracking();
    @Valid private Sending sending = new Sending();
    @Valid private Volume volume = new Volume();
    @Valid private ReportCache reportCache = new ReportCache();
    @Valid private Enrichment enrichment = new Enrichment();
    @Valid private Catalog catalog = new Catalog();
    @Valid private Resilience resilience = new Resilience();
    @Valid private Scheduling scheduling = new Scheduling();

    @Data
    public static class Tracking {
        @Min(1)
        private int lookbackDays = 30;

        @NotBlank private String zoneId = "America/Los_Angeles";

        /** Pause between consecutive entity-report requests */
        @NotNull private Duration reportSpacing = Duration.ofSeconds(10);

        /** Wait before the single retry of a failed report */
        @NotNull private Duration retryBackoff = Duration.ofSeconds(60);

        /** Pause between per-day conversion requests */
        @NotNull private Duration conversionDaySpacing = Duration.ofMillis(200);

        @Min(1)
        private int conversionPageSize = 500;

        @NotNull private Duration callTimeout = Duration.ofMinutes(2);

        /** Force a full fetch when the last one is older than this */
        @NotNull private Duration fullRefreshInterval = Duration.ofHours(24);

        @Min(1)
        private int recentConversionsLimit = 100;
    }

    @Data
    public static class Sending {
        @NotNull private Duration callTimeout = Duration.ofSeconds(60);

        @Min(1)
        private int campaignLookbackDays = 90;
    }

    @Data
    public static class Volume {
        /** TTL for exact contact-export volumes */
        @NotNull private Duration exactTtl = Duration.ofHours(24);

        /** TTL for segment, list and proportional volumes */
        @NotNull private Duration estimatedTtl = Duration.ofMinutes(30);

        @NotNull private Duration totalSendsTtl = Duration.ofMinutes(30);

        /** A strategy must yield more than this many data-set codes to be accepted */
        @Min(0)
        private int minDistinctIdentifiers = 2;

        @NotBlank private String snapshotKeyPrefix = "attribution:volume:";

        @Valid private Export export = new Export();

        @Data
        public static class Export {
            private boolean enabled = true;

            @NotNull private Duration pollInterval = Duration.ofSeconds(15);

            @NotNull private Duration maxWait = Duration.ofMinutes(30);

            @NotNull private Duration rateLimitBackoff = Duration.ofSeconds(30);

            @NotNull private Duration maxRateLimitBackoff = Duration.ofMinutes(5);

            @NotNull private Duration cleanupTimeout = Duration.ofSeconds(30);

            @Min(1)
            private int corePoolSize = 2;

            @Min(1)
            private int maxPoolSize = 4;

            @Min(0)
            private int queueCapacity = 20;
        }
    }

    @Data
    public static class ReportCache {
        @NotNull private Duration ttl = Duration.ofMinutes(15);
    }

    @Data
    public static class Enrichment {
        @Min(1)
        private int maxLookups = 50;

        @NotNull private Duration lookupSpacing = Duration.ofMillis(100);

        @NotNull private Duration campaignCacheTtl = Duration.ofMinutes(15);
    }

    @Data
    public static class Catalog {
        /** Property code to property (domain) name */
        private Map<String, String> properties = defaultProperties();

        /** External data-partner prefix to partner name */
        private Map<String, String> partners = defaultPartners();

        /** Data-set codes that do not follow the prefix rule, mapped to a partner key */
        private Map<String, String> dataSetOverrides = defaultOverrides();

        @NotBlank private String defaultPartnerCode = "IGN";

        @NotBlank private String defaultPartnerName = "Ignite";

        private static Map<String, String> defaultProperties() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("FTT", "FinancialTipsToday");
            map.put("DHF", "dailyhistoryfacts.org");
            map.put("SFT", "savvyfinancetips.net");
            map.put("EHG", "everydayhealthguide.net");
            map.put("BPG", "bestpropertyguides.net");
            map.put("JOTD", "jokeoftheday.info");
            map.put("SH", "sportshistory.info");
            map.put("NPY", "newproductsforyou.com");
            map.put("FNI", "e.financialsinfo.com");
            map.put("AFI", "affordinginsurance.com");
            map.put("SBD", "secretbeautydiscounts.com");
            map.put("OTD", "theoftheday.com");
            map.put("HRO", "horoscopeinfo.com");
            map.put("TDIH", "thisdayinhistory.co");
            map.put("OTDD", "onthisdaydaily.com");
            map.put("FMO", "financial-money.com");
            map.put("ALC", "alcatrazblog.com");
            map.put("MHH", "myhealthyhabitsblog.net");
            map.put("GHH", "goodhomehub.org");
            map.put("DIH", "dayinhistory.org");
            map.put("FTD", "financialtipsdaily.net");
            map.put("FYF", "findyourfit.net");
            map.put("IGN", "ignitemedia.com");
            return map;
        }

        private static Map<String, String> defaultPartners() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("ATT", "Attribits");
            map.put("GLB", "GlobeUSA");
            map.put("SCO", "Suited Connector");
            map.put("M77", "Media717");
            return map;
        }

        private static Map<String, String> defaultOverrides() {
            Map<String, String> map = new LinkedHashMap<>();
            map.put("ATT", "IGN");
            map.put("GLB_BR", "IGN");
            map.put("SCO_BATH", "IGN");
            map.put("M77_HW", "IGN");
            map.put("BANKRUPTCYSEND", "ATT");
            map.put("HAR_HOME_09232024", "GLB");
            map.put("MAS_SP", "M77");
            map.put("SENIOR_SIGNAL", "IGN");
            return map;
        }
    }

    @Data
    public static class Resilience {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull private Duration initialInterval = Duration.ofSeconds(2);

        private double multiplier = 2.0;

        private double randomizationFactor = 0.5;

        @NotNull private Duration maxInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Scheduling {
        @Valid private Sync trackingSync = new Sync(Duration.ofMinutes(15));
        @Valid private Sync sendingSync = new Sync(Duration.ofMinutes(30));
        @Valid private Sync partnerCache = new Sync(Duration.ofMinutes(15));

        @Data
        public static class Sync {
            private boolean enabled = true;

            @NotNull private Duration interval;

            public Sync() {}

            public Sync(Duration interval) {
                this.interval = interval;
            }
        }
    }
}
