package com.evintel.charging.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawTrafficObservation {

    @JsonProperty("station_id")
    private String stationId;

    private String timestamp;

    @JsonProperty("traffic_density")
    private Double trafficDensity;

    @JsonProperty("average_speed_kmh")
    private Double averageSpeedKmh;

    @JsonProperty("congestion_level")
    private String congestionLevel;

    @JsonProperty("road_type")
    private String roadType;

    @JsonProperty("distance_to_station_km")
    private Double distanceToStationKm;
}
