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
public class RawChargingPoint {

    private String id;

    @JsonProperty("station_id")
    private String stationId;

    @JsonProperty("connector_type")
    private String connectorType;

    @JsonProperty("power_kw")
    private Double powerKw;

    private String status;
}
