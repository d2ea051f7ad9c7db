package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Daily energy rollup for a station, split by the day's peak usage hours.
 * One record per (stationId, date), replaced on re-run.
 */
@Value
@Builder
public class EnergyConsumptionRecord {

    String stationId;
    LocalDate date;
    double totalEnergyKwh;
    double peakHourEnergyKwh;
    double offPeakEnergyKwh;
    int sessionCount;
    /** Mean duration of completed sessions; null when none completed */
    Double avgSessionDurationMinutes;
}
