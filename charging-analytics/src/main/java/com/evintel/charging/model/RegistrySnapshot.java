package com.evintel.charging.model;

import java.util.List;

/**
 * Station/point registry as returned by the station collector, full or incremental.
 */
public record RegistrySnapshot(List<RawStation> stations, List<RawChargingPoint> points) {
}
