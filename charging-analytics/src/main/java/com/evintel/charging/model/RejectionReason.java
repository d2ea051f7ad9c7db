package com.evintel.charging.model;

public enum RejectionReason {
    MISSING_REQUIRED_FIELD("missing_required_field"),
    OUT_OF_RANGE("out_of_range"),
    MALFORMED_TIMESTAMP("malformed_timestamp"),
    UNKNOWN_STATION_REFERENCE("unknown_station_reference"),
    /** Replaced by a later row with the same id in the same snapshot */
    SUPERSEDED_DUPLICATE("superseded_duplicate");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
