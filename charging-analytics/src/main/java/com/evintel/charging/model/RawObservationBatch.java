package com.evintel.charging.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw collector rows for one station and time window.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawObservationBatch(
        @JsonProperty("sessions") List<RawUsageSession> sessions,
        @JsonProperty("weather") List<RawWeatherObservation> weather,
        @JsonProperty("traffic") List<RawTrafficObservation> traffic,
        @JsonProperty("status_events") List<RawStatusEvent> statusEvents) {

    public static RawObservationBatch empty() {
        return new RawObservationBatch(List.of(), List.of(), List.of(), List.of());
    }
}
