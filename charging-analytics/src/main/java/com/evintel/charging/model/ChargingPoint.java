package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChargingPoint {

    String id;
    String stationId;
    String connectorType;
    /** Rated power in kW, never negative */
    double ratedPowerKw;
    StationStatus status;
}
