package com.evintel.charging.model;

import java.util.List;

/**
 * Everything normalised for one station across the cycle's history window.
 * Sessions are already de-duplicated by session id.
 */
public record StationData(Station station,
                          List<UsageSession> sessions,
                          List<WeatherObservation> weather,
                          List<TrafficObservation> traffic,
                          List<StatusEvent> statusEvents) {
}
