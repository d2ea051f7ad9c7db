package com.evintel.charging.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.Set;

/**
 * Canonical charging station from the registry snapshot.
 * Location is always within valid lat/long bounds once normalised.
 */
@Value
@Builder
public class Station {

    /** Stable external key, e.g. the OpenChargeMap POI id */
    String id;
    String name;
    double latitude;
    double longitude;
    String operator;
    String network;
    StationStatus status;

    @With
    @Singular
    Set<String> pointIds;
}
