package com.evintel.charging.model;

import java.util.Arrays;

public enum AnomalyType {
    UNUSUAL_DOWNTIME("unusual_downtime"),
    USAGE_SPIKE("usage_spike"),
    WEATHER_RELATED("weather_related"),
    TRAFFIC_CORRELATION("traffic_correlation"),
    SEASONAL_DEVIATION("seasonal_deviation");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    /** Stored and exported form, e.g. "usage_spike" */
    public String code() {
        return code;
    }

    public static AnomalyType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown anomaly type: " + code));
    }
}
