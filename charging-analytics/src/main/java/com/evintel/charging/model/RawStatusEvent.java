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
public class RawStatusEvent {

    @JsonProperty("station_id")
    private String stationId;

    private String timestamp;

    private String status;

    @JsonProperty("available_points")
    private Integer availablePoints;

    @JsonProperty("total_points")
    private Integer totalPoints;
}
