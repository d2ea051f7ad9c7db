package com.evintel.charging.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * All tunables for the collection cycle. Defaults here are the documented defaults;
 * application.yml only overrides what differs per environment.
 */
@Component
@ConfigurationProperties(prefix = "charging-analytics")
@Data
public class ChargingAnalyticsProperties {

    private Features features = new Features();
    private Anomaly anomaly = new Anomaly();
    private Holidays holidays = new Holidays();
    private Collection collection = new Collection();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Features {
        /** Lower-case weather condition codes that count as storm weather */
        private List<String> stormConditions = new ArrayList<>(List.of("thunderstorm", "storm", "squall", "tornado"));
        /** Hour's sessions must reach this multiple of the trailing same-hour average */
        private double stormMultiplier = 1.5;
        private int stormTrailingDays = 7;
        /** Also emit one record per hour that had sessions */
        private boolean hourlyFeatures = true;
    }

    @Data
    public static class Anomaly {
        private int baselineDays = 30;
        private double severityThreshold = 0.6;
        private int minBaselineSamples = 7;
        /** Floor applied to the baseline stddev before dividing */
        private double severityEpsilon = 1.0;
        /** |r| inside this band means "no expected correlation" */
        private double correlationBand = 0.1;
        private int seasonalLookbackWeeks = 4;
        private int seasonalMinBaselineSamples = 4;
        /** Storm spike ratio that maps to severity 1.0 */
        private double stormRatioForFullSeverity = 2.0;
    }

    @Data
    public static class Holidays {
        /** Recurring holidays as MM-dd */
        private List<String> fixedDates = new ArrayList<>(List.of("01-01", "07-04", "12-25"));
        /** One-off holidays as yyyy-MM-dd */
        private List<String> extraDates = new ArrayList<>();
    }

    @Data
    public static class Collection {
        private long timeoutMs = 30_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        /** Stations processed concurrently within one cycle */
        private int parallelism = 4;
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 */2 * * *";
        private boolean runOnStartup = false;
        private int backfillDays = 30;
    }
}
