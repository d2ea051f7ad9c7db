package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AnomalyEvaluation;
import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.AnomalyType;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.FeatureSet;
import com.evintel.charging.model.StationData;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Scores each anomaly type for a station's current period against its trailing baseline
 * and reconciles the result with the station's open anomalies.
 *
 * Per (station, type): none → open → resolved. A type already open stays open and is not
 * duplicated; an open type whose severity falls below the threshold is resolved at the
 * cycle timestamp. A type whose baseline is too small is skipped entirely, leaving any open
 * record untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyEngine {

    private final ChargingAnalyticsProperties properties;

    public AnomalyEvaluation evaluate(StationData data,
                                      LocalDate date,
                                      LocalDateTime cycleTimestamp,
                                      FeatureSet current,
                                      List<EngineeredFeatureRecord> history,
                                      Map<AnomalyType, AnomalyRecord> open) {
        ChargingAnalyticsProperties.Anomaly cfg = properties.getAnomaly();
        String stationId = data.station().getId();
        Map<LocalDate, EngineeredFeatureRecord> baseline = dailyBaseline(stationId, date, history, cfg.getBaselineDays());

        Map<AnomalyType, Score> scores = new EnumMap<>(AnomalyType.class);
        scores.put(AnomalyType.UNUSUAL_DOWNTIME, deviation(baseline.values(), current.daily(),
                EngineeredFeatureRecord::getAvgDowntimeMinutes, cfg.getMinBaselineSamples(), "Average downtime minutes"));
        scores.put(AnomalyType.USAGE_SPIKE, deviation(baseline.values(), current.daily(),
                r -> r.getTotalSessions(), cfg.getMinBaselineSamples(), "Session count"));
        scores.put(AnomalyType.WEATHER_RELATED, weather(current));
        scores.put(AnomalyType.TRAFFIC_CORRELATION, trafficCorrelation(data, date));
        scores.put(AnomalyType.SEASONAL_DEVIATION, deviation(sameWeekday(stationId, history, date), current.daily(),
                EngineeredFeatureRecord::getTotalEnergyKwh, cfg.getSeasonalMinBaselineSamples(),
                "Total energy kWh vs same weekday"));

        List<AnomalyRecord> opened = new ArrayList<>();
        List<AnomalyRecord> resolved = new ArrayList<>();
        Map<AnomalyType, Double> severities = new EnumMap<>(AnomalyType.class);
        Map<AnomalyType, String> suppressed = new EnumMap<>(AnomalyType.class);

        for (Map.Entry<AnomalyType, Score> e : scores.entrySet()) {
            AnomalyType type = e.getKey();
            Score score = e.getValue();
            AnomalyRecord existing = open.get(type);

            if (score.suppressedBecause() != null) {
                suppressed.put(type, score.suppressedBecause());
                log.debug("Station {} {}: {} suppressed ({})", stationId, date, type.code(), score.suppressedBecause());
                continue;
            }
            severities.put(type, score.severity());

            if (score.severity() >= cfg.getSeverityThreshold()) {
                if (existing == null) {
                    opened.add(AnomalyRecord.builder()
                            .stationId(stationId)
                            .type(type)
                            .severityScore(score.severity())
                            .detectedAt(cycleTimestamp)
                            .description(score.description())
                            .resolved(false)
                            .build());
                    log.info("Station {} {}: {} anomaly opened, severity {}", stationId, date, type.code(),
                            String.format("%.3f", score.severity()));
                }
            } else if (existing != null) {
                resolved.add(existing.toBuilder()
                        .resolved(true)
                        .resolvedAt(cycleTimestamp)
                        .build());
                log.info("Station {} {}: {} anomaly resolved", stationId, date, type.code());
            }
        }
        return new AnomalyEvaluation(opened, resolved, severities, suppressed);
    }

    // ── Scoring ──────────────────────────────────────────────────────────────

    private Score deviation(Iterable<EngineeredFeatureRecord> baseline,
                            EngineeredFeatureRecord current,
                            ToDoubleFunction<EngineeredFeatureRecord> metric,
                            int minSamples,
                            String label) {
        List<Double> values = new ArrayList<>();
        for (EngineeredFeatureRecord r : baseline) values.add(metric.applyAsDouble(r));
        if (values.size() < minSamples) {
            return Score.suppressed("insufficient_baseline: " + values.size() + " of " + minSamples + " periods");
        }
        BaselineStats stats = BaselineStats.of(values);
        double value = metric.applyAsDouble(current);
        double severity = stats.severity(value, properties.getAnomaly().getSeverityEpsilon());
        return Score.of(severity, String.format("%s %.2f vs baseline mean %.2f (stddev %.2f, n=%d)",
                label, value, stats.mean(), stats.stddev(), stats.n()));
    }

    /** Driven by the storm spike feature; needs no baseline beyond the one the feature used. */
    private Score weather(FeatureSet current) {
        Double ratio = current.maxStormSpikeRatio();
        if (ratio == null || !current.daily().isStormUsageSpike()) {
            return Score.of(0.0, "No storm usage spike");
        }
        double full = properties.getAnomaly().getStormRatioForFullSeverity();
        double severity = full > 0 ? BaselineStats.clamp(ratio / full) : 1.0;
        return Score.of(severity, String.format(
                "Storm usage spike: sessions %.2fx the trailing same-hour average", ratio));
    }

    /**
     * Pearson r between hourly session counts and mean hourly traffic density over every hour
     * bucket in the baseline window (current day included) that has a traffic reading.
     */
    private Score trafficCorrelation(StationData data, LocalDate date) {
        ChargingAnalyticsProperties.Anomaly cfg = properties.getAnomaly();
        LocalDateTime from = date.minusDays(cfg.getBaselineDays()).atStartOfDay();
        LocalDateTime to = date.plusDays(1).atStartOfDay();

        Map<LocalDateTime, double[]> density = new TreeMap<>();
        for (TrafficObservation t : data.traffic()) {
            if (t.getTrafficDensity() == null) continue;
            if (t.getTimestamp().isBefore(from) || !t.getTimestamp().isBefore(to)) continue;
            double[] acc = density.computeIfAbsent(TemporalAligner.hourBucket(t.getTimestamp()), k -> new double[2]);
            acc[0] += t.getTrafficDensity();
            acc[1]++;
        }
        if (density.size() < cfg.getMinBaselineSamples()) {
            return Score.suppressed("insufficient_baseline: " + density.size() + " of "
                    + cfg.getMinBaselineSamples() + " traffic hours");
        }

        Map<LocalDateTime, Integer> sessions = new HashMap<>();
        for (UsageSession s : data.sessions()) {
            sessions.merge(TemporalAligner.hourBucket(s.getStart()), 1, Integer::sum);
        }

        double[] x = new double[density.size()];
        double[] y = new double[density.size()];
        int i = 0;
        for (Map.Entry<LocalDateTime, double[]> e : density.entrySet()) {
            x[i] = e.getValue()[0] / e.getValue()[1];
            y[i] = sessions.getOrDefault(e.getKey(), 0);
            i++;
        }
        Double r = BaselineStats.pearson(x, y);
        if (r == null) {
            return Score.suppressed("insufficient_baseline: no variance in hourly sessions or traffic");
        }

        double band = cfg.getCorrelationBand();
        double severity = band >= 1.0 ? 0.0 : BaselineStats.clamp((Math.abs(r) - band) / (1.0 - band));
        return Score.of(severity, String.format("Hourly sessions vs traffic density r=%.3f over %d hours (band ±%.2f)",
                r, x.length, band));
    }

    // ── Baselines ────────────────────────────────────────────────────────────

    private Map<LocalDate, EngineeredFeatureRecord> dailyBaseline(String stationId, LocalDate date,
                                                                  List<EngineeredFeatureRecord> history, int days) {
        LocalDate from = date.minusDays(days);
        Map<LocalDate, EngineeredFeatureRecord> byDate = new TreeMap<>();
        for (EngineeredFeatureRecord r : history) {
            if (!r.isDaily() || !stationId.equals(r.getStationId())) continue;
            if (r.getDate().isBefore(from) || !r.getDate().isBefore(date)) continue;
            byDate.putIfAbsent(r.getDate(), r);
        }
        return byDate;
    }

    /**
     * Same weekday in each of the prior lookback weeks, where a record exists. Read from the
     * whole history rather than the z-score window, which may be shorter than the lookback.
     */
    private List<EngineeredFeatureRecord> sameWeekday(String stationId, List<EngineeredFeatureRecord> history,
                                                      LocalDate date) {
        int weeks = properties.getAnomaly().getSeasonalLookbackWeeks();
        Map<LocalDate, EngineeredFeatureRecord> byDate =
                dailyBaseline(stationId, date, history, weeks * 7);
        List<EngineeredFeatureRecord> out = new ArrayList<>();
        for (int w = 1; w <= weeks; w++) {
            EngineeredFeatureRecord r = byDate.get(date.minusWeeks(w));
            if (r != null) out.add(r);
        }
        return out;
    }

    private record Score(double severity, String description, String suppressedBecause) {

        static Score of(double severity, String description) {
            return new Score(severity, description, null);
        }

        static Score suppressed(String reason) {
            return new Score(0.0, null, reason);
        }
    }
}
