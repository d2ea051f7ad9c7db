package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AlignedSession;
import com.evintel.charging.model.EnergyConsumptionRecord;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.FeatureSet;
import com.evintel.charging.model.StationData;
import com.evintel.charging.model.StatusEvent;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the engineered feature vector for one station and day, plus one record per
 * hour that had sessions, and the day's energy rollup.
 *
 * Everything is recomputed from source rows on each call, so re-running a period
 * produces identical records.
 */
@Component
@Slf4j
public class FeatureEngine {

    private static final int HOURS_PER_DAY = 24;

    private final ChargingAnalyticsProperties.Features config;
    private final HolidayCalendar holidayCalendar;
    private final Set<String> stormConditions;

    public FeatureEngine(ChargingAnalyticsProperties properties, HolidayCalendar holidayCalendar) {
        this.config = properties.getFeatures();
        this.holidayCalendar = holidayCalendar;
        this.stormConditions = config.getStormConditions().stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param data    the station's normalised rows for the whole history window; sessions
     *                before {@code date} feed the trailing storm baseline
     * @param aligned aligned sessions starting on {@code date}
     */
    public FeatureSet compute(StationData data, List<AlignedSession> aligned, LocalDate date) {
        String stationId = data.station().getId();
        LocalDateTime dayStart = date.atStartOfDay();
        LocalDateTime dayEnd = dayStart.plusDays(1);

        List<AlignedSession> day = aligned.stream()
                .filter(a -> !a.session().getStart().isBefore(dayStart) && a.session().getStart().isBefore(dayEnd))
                .toList();
        checkInvariants(stationId, day);

        int[] hourlyCounts = hourlyCounts(day);
        boolean[] peak = peakHours(hourlyCounts);
        Double[] spikeRatios = stormSpikeRatios(date, hourlyCounts, day, data.sessions());

        EngineeredFeatureRecord daily = record(stationId, date, null, dayStart, dayEnd, day, data,
                anySpike(spikeRatios), countPeaks(peak));

        List<EngineeredFeatureRecord> hourly = new ArrayList<>();
        if (config.isHourlyFeatures()) {
            for (int h = 0; h < HOURS_PER_DAY; h++) {
                if (hourlyCounts[h] == 0) continue;
                LocalDateTime hourStart = dayStart.plusHours(h);
                int hour = h;
                List<AlignedSession> inHour = day.stream()
                        .filter(a -> a.session().getStart().getHour() == hour)
                        .toList();
                hourly.add(record(stationId, date, h, hourStart, hourStart.plusHours(1), inHour, data,
                        spikeRatios[h] != null, peak[h] ? 1 : 0));
            }
        }

        Double maxRatio = null;
        for (Double r : spikeRatios) {
            if (r != null && (maxRatio == null || r > maxRatio)) maxRatio = r;
        }

        EnergyConsumptionRecord energy = energyRollup(stationId, date, day, peak);

        log.debug("Station {} {}: {} sessions, {} kWh, {} peak hours, storm spike {}",
                stationId, date, daily.getTotalSessions(), daily.getTotalEnergyKwh(),
                daily.getPeakUsageHours(), daily.isStormUsageSpike());
        return new FeatureSet(daily, hourly, energy, maxRatio);
    }

    // ── Record assembly ──────────────────────────────────────────────────────

    private EngineeredFeatureRecord record(String stationId, LocalDate date, Integer hour,
                                           LocalDateTime from, LocalDateTime to,
                                           List<AlignedSession> sessions, StationData data,
                                           boolean stormSpike, int peakHours) {
        DayOfWeek dow = date.getDayOfWeek();
        double energy = sessions.stream().mapToDouble(a -> a.session().getEnergyKwh()).sum();
        List<StatusEvent> events = data.statusEvents();

        return EngineeredFeatureRecord.builder()
                .stationId(stationId)
                .date(date)
                .hourOfDay(hour)
                .dayOfWeek(dow.getValue())
                .weekend(dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY)
                .holiday(holidayCalendar.isHoliday(date))
                .avgDowntimeMinutes(StatusIntervals.averageMinutes(
                        StatusIntervals.clip(events, e -> !e.isOperational(), from, to)))
                .avgWaitTimeMinutes(StatusIntervals.averageMinutes(
                        StatusIntervals.clip(events, StatusEvent::isFullyOccupied, from, to)))
                .energyPerTrafficDensity(energyPerTraffic(energy, data.traffic(), from, to))
                .stormUsageSpike(stormSpike)
                .peakUsageHours(peakHours)
                .totalSessions(sessions.size())
                .totalEnergyKwh(energy)
                .build();
    }

    /**
     * Period energy over mean traffic density in the period. Null without usable traffic
     * observations or when the mean density is zero.
     */
    static Double energyPerTraffic(double energy, List<TrafficObservation> traffic,
                                   LocalDateTime from, LocalDateTime to) {
        double sum = 0;
        int n = 0;
        for (TrafficObservation t : traffic) {
            if (t.getTrafficDensity() == null) continue;
            if (t.getTimestamp().isBefore(from) || !t.getTimestamp().isBefore(to)) continue;
            sum += t.getTrafficDensity();
            n++;
        }
        if (n == 0) return null;
        double mean = sum / n;
        return mean > 0 ? energy / mean : null;
    }

    // ── Hourly usage ─────────────────────────────────────────────────────────

    private int[] hourlyCounts(List<AlignedSession> day) {
        int[] counts = new int[HOURS_PER_DAY];
        for (AlignedSession a : day) {
            counts[a.session().getStart().getHour()]++;
        }
        return counts;
    }

    /** Hours whose count exceeds mean + one population stddev of the day's 24 hourly counts. */
    static boolean[] peakHours(int[] counts) {
        double mean = 0;
        for (int c : counts) mean += c;
        mean /= counts.length;
        double var = 0;
        for (int c : counts) var += (c - mean) * (c - mean);
        double cutoff = mean + Math.sqrt(var / counts.length);

        boolean[] peak = new boolean[counts.length];
        for (int h = 0; h < counts.length; h++) {
            peak[h] = counts[h] > cutoff;
        }
        return peak;
    }

    private int countPeaks(boolean[] peak) {
        int n = 0;
        for (boolean p : peak) if (p) n++;
        return n;
    }

    // ── Storm spike ──────────────────────────────────────────────────────────

    /**
     * Per hour: the ratio of the hour's sessions to the trailing same-hour average when the
     * hour had storm weather and the ratio reached the multiplier, otherwise null.
     * Days without sessions count as zero in the average; a zero average never spikes.
     */
    private Double[] stormSpikeRatios(LocalDate date, int[] hourlyCounts,
                                      List<AlignedSession> day, List<UsageSession> history) {
        Double[] ratios = new Double[HOURS_PER_DAY];
        boolean[] storm = new boolean[HOURS_PER_DAY];
        for (AlignedSession a : day) {
            if (a.weather() != null && isStorm(a.weather().getCondition())) {
                storm[a.session().getStart().getHour()] = true;
            }
        }

        int trailingDays = config.getStormTrailingDays();
        LocalDateTime trailingStart = date.minusDays(trailingDays).atStartOfDay();
        LocalDateTime dayStart = date.atStartOfDay();
        Map<LocalDateTime, Integer> perBucket = new HashMap<>();
        for (UsageSession s : history) {
            if (s.getStart().isBefore(trailingStart) || !s.getStart().isBefore(dayStart)) continue;
            perBucket.merge(TemporalAligner.hourBucket(s.getStart()), 1, Integer::sum);
        }

        for (int h = 0; h < HOURS_PER_DAY; h++) {
            if (!storm[h] || hourlyCounts[h] == 0) continue;
            int total = 0;
            for (int d = 1; d <= trailingDays; d++) {
                total += perBucket.getOrDefault(date.minusDays(d).atTime(h, 0), 0);
            }
            double average = trailingDays > 0 ? (double) total / trailingDays : 0.0;
            if (average <= 0) continue;
            double ratio = hourlyCounts[h] / average;
            if (ratio >= config.getStormMultiplier()) {
                ratios[h] = ratio;
            }
        }
        return ratios;
    }

    private boolean isStorm(String condition) {
        return condition != null && stormConditions.contains(condition.toLowerCase(Locale.ROOT));
    }

    private boolean anySpike(Double[] ratios) {
        for (Double r : ratios) if (r != null) return true;
        return false;
    }

    // ── Energy rollup ────────────────────────────────────────────────────────

    private EnergyConsumptionRecord energyRollup(String stationId, LocalDate date,
                                                 List<AlignedSession> day, boolean[] peak) {
        double total = 0;
        double peakEnergy = 0;
        long durationSeconds = 0;
        int completed = 0;
        for (AlignedSession a : day) {
            UsageSession s = a.session();
            total += s.getEnergyKwh();
            if (peak[s.getStart().getHour()]) peakEnergy += s.getEnergyKwh();
            Duration d = s.getDuration();
            if (d != null) {
                durationSeconds += d.getSeconds();
                completed++;
            }
        }
        return EnergyConsumptionRecord.builder()
                .stationId(stationId)
                .date(date)
                .totalEnergyKwh(total)
                .peakHourEnergyKwh(peakEnergy)
                .offPeakEnergyKwh(total - peakEnergy)
                .sessionCount(day.size())
                .avgSessionDurationMinutes(completed == 0 ? null : durationSeconds / 60.0 / completed)
                .build();
    }

    private void checkInvariants(String stationId, List<AlignedSession> day) {
        for (AlignedSession a : day) {
            UsageSession s = a.session();
            if (s.getEnd() != null && !s.getEnd().isAfter(s.getStart())) {
                throw new ComputationInvariantException(stationId,
                        "session " + s.getId() + " has non-positive duration");
            }
            if (s.getEnergyKwh() < 0) {
                throw new ComputationInvariantException(stationId,
                        "session " + s.getId() + " has negative energy " + s.getEnergyKwh());
            }
        }
    }
}
