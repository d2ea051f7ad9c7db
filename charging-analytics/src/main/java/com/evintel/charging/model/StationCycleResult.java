package com.evintel.charging.model;

import java.time.LocalDate;

/**
 * Everything one station produced for a period. Persisted all-or-nothing.
 */
public record StationCycleResult(String stationId, LocalDate date, FeatureSet features, AnomalyEvaluation anomalies) {
}
