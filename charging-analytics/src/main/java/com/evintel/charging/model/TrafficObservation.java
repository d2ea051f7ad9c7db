package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class TrafficObservation {

    String stationId;
    LocalDateTime timestamp;
    Double trafficDensity;
    Double averageSpeedKmh;
    CongestionLevel congestionLevel;
    String roadType;
    Double distanceToStationKm;
}
