package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Engineered feature vector for one station and one day, or one hour of that day.
 *
 * Natural key is (stationId, date, hourOfDay). Writing a record for a key that already
 * exists replaces it.
 */
@Value
@Builder
public class EngineeredFeatureRecord {

    String stationId;
    LocalDate date;
    /** 0-23 for hourly records, null for the daily record */
    Integer hourOfDay;

    // ── Temporal ────────────────────────────────────────────────────────────
    /** ISO day of week, Monday = 1 … Sunday = 7 */
    int dayOfWeek;
    boolean weekend;
    boolean holiday;

    // ── Availability ────────────────────────────────────────────────────────
    double avgDowntimeMinutes;
    double avgWaitTimeMinutes;

    // ── Correlation ─────────────────────────────────────────────────────────
    /** Total energy / mean traffic density; null without traffic observations */
    Double energyPerTrafficDensity;
    boolean stormUsageSpike;

    // ── Usage ───────────────────────────────────────────────────────────────
    int peakUsageHours;
    int totalSessions;
    double totalEnergyKwh;

    public boolean isDaily() {
        return hourOfDay == null;
    }
}
