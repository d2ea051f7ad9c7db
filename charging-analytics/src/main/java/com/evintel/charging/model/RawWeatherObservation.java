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
public class RawWeatherObservation {

    @JsonProperty("station_id")
    private String stationId;

    private String timestamp;

    @JsonProperty("temperature_celsius")
    private Double temperatureCelsius;

    @JsonProperty("humidity_percent")
    private Double humidityPercent;

    @JsonProperty("pressure_hpa")
    private Double pressureHpa;

    @JsonProperty("wind_speed_ms")
    private Double windSpeedMs;

    @JsonProperty("wind_direction_degrees")
    private Double windDirectionDegrees;

    @JsonProperty("precipitation_mm")
    private Double precipitationMm;

    @JsonProperty("weather_condition")
    private String weatherCondition;

    @JsonProperty("visibility_km")
    private Double visibilityKm;

    @JsonProperty("uv_index")
    private Double uvIndex;
}
