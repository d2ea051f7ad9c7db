package com.evintel.charging.model;

/**
 * A usage session joined with the weather and traffic observations from its start-hour bucket.
 * Either correlate is null when the bucket holds no observation.
 */
public record AlignedSession(UsageSession session, WeatherObservation weather, TrafficObservation traffic) {
}
