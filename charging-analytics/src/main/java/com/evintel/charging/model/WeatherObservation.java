package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Weather sample at a station. Numeric readings are null when the collector
 * did not report them or they fell outside plausible bounds.
 */
@Value
@Builder
public class WeatherObservation {

    String stationId;
    LocalDateTime timestamp;
    Double temperatureCelsius;
    Double humidityPercent;
    Double pressureHpa;
    Double windSpeedMs;
    Double windDirectionDegrees;
    Double precipitationMm;
    /** Lower-cased condition code, e.g. "thunderstorm", "rain", "clear" */
    String condition;
    Double visibilityKm;
    Double uvIndex;
}
