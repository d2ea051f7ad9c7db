package com.evintel.charging.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Correlates hourly charging demand with the weather and traffic readings landed for the same station and hour.
 * <p>
 * Usage is bucketed per (station, hour) as a session count. Each weather or traffic reading inside a bucket that
 * has usage contributes one paired sample; hours without sessions are not paired.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorrelationAnalysisService {

    static final double INSIGHT_THRESHOLD = 0.3;
    static final double STRONG_THRESHOLD = 0.5;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Weather, traffic and combined sections plus a summary.
     *
     * @param stationId null for the whole network
     */
    public Map<String, Object> getCorrelationReport(String stationId) {
        String station = blankToNull(stationId);
        log.info("Correlation report for {}", station == null ? "all stations" : station);

        Map<HourKey, Integer> usage = hourlySessionCounts(station);
        List<Map<String, Object>> weather = rows("""
                SELECT station_id, observed_at, temperature_celsius, precipitation_mm, weather_condition
                FROM weather_data
                """, station);
        List<Map<String, Object>> traffic = rows("""
                SELECT station_id, observed_at, traffic_density, average_speed_kmh, congestion_level
                FROM traffic_data
                """, station);

        Map<String, Object> weatherSection = weatherCorrelation(usage, weather);
        Map<String, Object> trafficSection = trafficCorrelation(usage, traffic);
        Map<String, Object> combinedSection = combinedCorrelation(usage, weather, traffic);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("weatherDataPoints", weatherSection.get("dataPoints"));
        summary.put("trafficDataPoints", trafficSection.get("dataPoints"));
        summary.put("combinedDataPoints", combinedSection.get("dataPoints"));
        summary.put("insightCount", insightCount(weatherSection) + insightCount(trafficSection)
                + insightCount(combinedSection));

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("stationId", station);
        report.put("weather", weatherSection);
        report.put("traffic", trafficSection);
        report.put("combined", combinedSection);
        report.put("summary", summary);
        return report;
    }

    Map<String, Object> weatherCorrelation(Map<HourKey, Integer> usage, List<Map<String, Object>> weather) {
        List<Sample> samples = pair(usage, weather);
        Map<String, Object> correlations = new LinkedHashMap<>();
        List<String> insights = new ArrayList<>();

        Double temperature = correlate(samples, r -> number(r.get("temperature_celsius")));
        Double precipitation = correlate(samples, r -> number(r.get("precipitation_mm")));
        correlations.put("temperatureVsSessions", temperature);
        correlations.put("precipitationVsSessions", precipitation);
        describe("Temperature", temperature, insights);
        describe("Precipitation", precipitation, insights);

        Map<String, Double> byCondition = meanSessionsBy(samples, "weather_condition");
        correlations.put("sessionsByCondition", byCondition);
        if (!byCondition.isEmpty()) {
            insights.add("Weather conditions with highest usage: " + top(byCondition, 3));
        }
        return section(samples.size(), correlations, insights);
    }

    Map<String, Object> trafficCorrelation(Map<HourKey, Integer> usage, List<Map<String, Object>> traffic) {
        List<Sample> samples = pair(usage, traffic);
        Map<String, Object> correlations = new LinkedHashMap<>();
        List<String> insights = new ArrayList<>();

        Double density = correlate(samples, r -> number(r.get("traffic_density")));
        Double speed = correlate(samples, r -> number(r.get("average_speed_kmh")));
        correlations.put("densityVsSessions", density);
        correlations.put("averageSpeedVsSessions", speed);
        describe("Traffic density", density, insights);
        describe("Average speed", speed, insights);

        Map<String, Double> byCongestion = meanSessionsBy(samples, "congestion_level");
        correlations.put("sessionsByCongestion", byCongestion);
        if (!byCongestion.isEmpty()) {
            insights.add("Congestion levels with highest usage: " + top(byCongestion, 3));
        }
        return section(samples.size(), correlations, insights);
    }

    Map<String, Object> combinedCorrelation(Map<HourKey, Integer> usage,
                                            List<Map<String, Object>> weather,
                                            List<Map<String, Object>> traffic) {
        Map<HourKey, List<Map<String, Object>>> trafficByHour = new HashMap<>();
        for (Map<String, Object> t : traffic) {
            if (t.get("observed_at") == null) continue;
            trafficByHour.computeIfAbsent(HourKey.of(t), k -> new ArrayList<>()).add(t);
        }
        List<Sample> samples = new ArrayList<>();
        for (Sample w : pair(usage, weather)) {
            for (Map<String, Object> t : trafficByHour.getOrDefault(HourKey.of(w.row()), List.of())) {
                Map<String, Object> joined = new HashMap<>(w.row());
                joined.putAll(t);
                samples.add(new Sample(joined, w.sessions()));
            }
        }

        Map<String, Object> correlations = new LinkedHashMap<>();
        correlations.put("temperature", correlate(samples, r -> number(r.get("temperature_celsius"))));
        correlations.put("precipitation", correlate(samples, r -> number(r.get("precipitation_mm"))));
        correlations.put("trafficDensity", correlate(samples, r -> number(r.get("traffic_density"))));
        correlations.put("averageSpeed", correlate(samples, r -> number(r.get("average_speed_kmh"))));

        Map<String, Double> strong = new TreeMap<>();
        correlations.forEach((k, v) -> {
            if (v != null && Math.abs((Double) v) > STRONG_THRESHOLD) strong.put(k, round((Double) v));
        });
        List<String> insights = new ArrayList<>();
        if (!strong.isEmpty()) {
            insights.add("Strong correlations found: " + strong);
        }
        return section(samples.size(), correlations, insights);
    }

    // ── Data access ───────────────────────────────────────────────────────────

    Map<HourKey, Integer> hourlySessionCounts(String stationId) {
        Map<HourKey, Integer> counts = new HashMap<>();
        for (Map<String, Object> row : rows("SELECT station_id, session_start AS observed_at FROM usage_data", stationId)) {
            if (row.get("observed_at") == null) continue;
            counts.merge(HourKey.of(row), 1, Integer::sum);
        }
        return counts;
    }

    private List<Map<String, Object>> rows(String select, String stationId) {
        if (stationId == null) {
            return jdbcTemplate.queryForList(select);
        }
        return jdbcTemplate.queryForList(select + " WHERE station_id = ?", stationId);
    }

    // ── Computation ───────────────────────────────────────────────────────────

    record HourKey(String stationId, LocalDateTime hour) {
        static HourKey of(Map<String, Object> row) {
            return new HourKey((String) row.get("station_id"),
                    TemporalAligner.hourBucket(dateTime(row.get("observed_at"))));
        }
    }

    record Sample(Map<String, Object> row, int sessions) {
    }

    private static List<Sample> pair(Map<HourKey, Integer> usage, List<Map<String, Object>> readings) {
        List<Sample> samples = new ArrayList<>();
        for (Map<String, Object> r : readings) {
            if (r.get("observed_at") == null) continue;
            Integer sessions = usage.get(HourKey.of(r));
            if (sessions != null) samples.add(new Sample(r, sessions));
        }
        return samples;
    }

    /** Pairwise-complete Pearson r; null with fewer than two pairs or no variance. */
    static Double correlate(List<Sample> samples, Function<Map<String, Object>, Double> metric) {
        List<double[]> pairs = new ArrayList<>();
        for (Sample s : samples) {
            Double v = metric.apply(s.row());
            if (v != null) pairs.add(new double[]{v, s.sessions()});
        }
        if (pairs.size() < 2) return null;
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return BaselineStats.pearson(x, y);
    }

    private static Map<String, Double> meanSessionsBy(List<Sample> samples, String column) {
        Map<String, double[]> acc = new TreeMap<>();
        for (Sample s : samples) {
            Object label = s.row().get(column);
            if (label == null) continue;
            double[] sumCount = acc.computeIfAbsent(label.toString(), k -> new double[2]);
            sumCount[0] += s.sessions();
            sumCount[1]++;
        }
        Map<String, Double> means = new LinkedHashMap<>();
        acc.forEach((k, v) -> means.put(k, v[0] / v[1]));
        return means;
    }

    private static void describe(String label, Double r, List<String> insights) {
        if (r == null || Math.abs(r) <= INSIGHT_THRESHOLD) return;
        String direction = r > 0 ? "positive" : "negative";
        insights.add("%s shows %s correlation (%.2f) with session count".formatted(label, direction, r));
    }

    private static Map<String, Double> top(Map<String, Double> means, int n) {
        Map<String, Double> out = new LinkedHashMap<>();
        means.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<String, Double> e) -> e.getValue()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(n)
                .forEach(e -> out.put(e.getKey(), round(e.getValue())));
        return out;
    }

    private static Map<String, Object> section(int dataPoints, Map<String, Object> correlations, List<String> insights) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("dataPoints", dataPoints);
        m.put("correlations", correlations);
        m.put("insights", insights);
        if (dataPoints == 0) {
            m.put("message", "No overlapping data points");
        }
        return m;
    }

    @SuppressWarnings("unchecked")
    private static int insightCount(Map<String, Object> section) {
        return ((List<String>) section.get("insights")).size();
    }

    static LocalDateTime dateTime(Object value) {
        if (value instanceof Timestamp) return ((Timestamp) value).toLocalDateTime();
        if (value instanceof LocalDateTime) return (LocalDateTime) value;
        throw new IllegalStateException("Unexpected timestamp value: " + value);
    }

    static Double number(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
