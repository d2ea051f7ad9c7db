package com.evintel.charging.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw session-close event. Timestamps are ISO-8601 strings, with or without offset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawUsageSession {

    private String id;

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("point_id")
    private String pointId;

    @JsonProperty("session_start")
    private String sessionStart;

    @JsonProperty("session_end")
    private String sessionEnd;

    @JsonProperty("energy_consumed_kwh")
    private Double energyConsumedKwh;

    private Double cost;
}
