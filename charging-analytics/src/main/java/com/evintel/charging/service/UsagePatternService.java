package com.evintel.charging.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.evintel.charging.service.CorrelationAnalysisService.blankToNull;
import static com.evintel.charging.service.CorrelationAnalysisService.dateTime;
import static com.evintel.charging.service.CorrelationAnalysisService.number;

/**
 * Descriptive usage patterns over the landed session history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsagePatternService {

    static final double PEAK_HOUR_FACTOR = 1.5;
    static final double SPIKE_Z = 2.0;
    static final double LOW_USAGE_Z = -1.5;

    private final JdbcTemplate jdbcTemplate;

    /**
     * @param stationId null for the whole network
     */
    public Map<String, Object> getUsagePatterns(String stationId) {
        String station = blankToNull(stationId);
        log.info("Usage patterns for {}", station == null ? "all stations" : station);

        String sql = """
                SELECT session_start, session_end, energy_consumed_kwh
                FROM usage_data
                WHERE session_start IS NOT NULL
                """;
        List<Map<String, Object>> rows = station == null
                ? jdbcTemplate.queryForList(sql)
                : jdbcTemplate.queryForList(sql + " AND station_id = ?", station);

        List<SessionRow> sessions = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object end = row.get("session_end");
            sessions.add(new SessionRow(
                    dateTime(row.get("session_start")),
                    end == null ? null : dateTime(end),
                    number(row.get("energy_consumed_kwh"))));
        }
        return analyze(station, sessions);
    }

    record SessionRow(LocalDateTime start, LocalDateTime end, Double energyKwh) {
    }

    Map<String, Object> analyze(String stationId, List<SessionRow> sessions) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("stationId", stationId);
        m.put("totalSessions", sessions.size());
        m.put("peakHours", peakHours(sessions));
        m.put("dayOfWeek", dayOfWeekPattern(sessions));

        Map<LocalDate, Integer> daily = new TreeMap<>();
        for (SessionRow s : sessions) daily.merge(s.start().toLocalDate(), 1, Integer::sum);
        BaselineStats stats = BaselineStats.of(daily.values().stream().map(Integer::doubleValue).toList());
        m.put("usageSpikes", outlierDays(daily, stats, true));
        m.put("lowUsageDays", outlierDays(daily, stats, false));

        m.put("sessionDuration", durationStats(sessions));
        m.put("seasonalTrends", seasonalTrends(sessions));
        return m;
    }

    /** Hours of day whose session count is at least 1.5x the mean over hours that saw any session. */
    static List<Integer> peakHours(List<SessionRow> sessions) {
        Map<Integer, Integer> byHour = new TreeMap<>();
        for (SessionRow s : sessions) byHour.merge(s.start().getHour(), 1, Integer::sum);
        if (byHour.isEmpty()) return List.of();
        double mean = (double) sessions.size() / byHour.size();
        List<Integer> peaks = new ArrayList<>();
        byHour.forEach((hour, count) -> {
            if (count >= mean * PEAK_HOUR_FACTOR) peaks.add(hour);
        });
        return peaks;
    }

    static Map<String, Object> dayOfWeekPattern(List<SessionRow> sessions) {
        int weekday = 0;
        int weekend = 0;
        double weekdayEnergy = 0.0;
        double weekendEnergy = 0.0;
        for (SessionRow s : sessions) {
            DayOfWeek dow = s.start().getDayOfWeek();
            double energy = s.energyKwh() == null ? 0.0 : s.energyKwh();
            if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
                weekend++;
                weekendEnergy += energy;
            } else {
                weekday++;
                weekdayEnergy += energy;
            }
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("weekdaySessions", weekday);
        m.put("weekendSessions", weekend);
        m.put("weekdayEnergyKwh", weekdayEnergy);
        m.put("weekendEnergyKwh", weekendEnergy);
        m.put("pattern", weekend > weekday ? "weekend_heavy" : "weekday_heavy");
        return m;
    }

    private static List<Map<String, Object>> outlierDays(Map<LocalDate, Integer> daily, BaselineStats stats, boolean high) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (stats.stddev() <= 0.0) return out;
        daily.forEach((date, count) -> {
            double z = (count - stats.mean()) / stats.stddev();
            if (high ? z > SPIKE_Z : z < LOW_USAGE_Z) {
                Map<String, Object> day = new LinkedHashMap<>();
                day.put("date", date.toString());
                day.put("sessionCount", count);
                day.put("zScore", z);
                out.add(day);
            }
        });
        return out;
    }

    /** Duration stats over completed sessions; ongoing sessions and negative spans are left out. */
    static Map<String, Object> durationStats(List<SessionRow> sessions) {
        List<Double> minutes = new ArrayList<>();
        for (SessionRow s : sessions) {
            if (s.end() == null || s.end().isBefore(s.start())) continue;
            minutes.add(Duration.between(s.start(), s.end()).getSeconds() / 60.0);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        if (minutes.isEmpty()) {
            m.put("description", "No completed sessions");
            return m;
        }
        minutes.sort(Double::compare);
        BaselineStats stats = BaselineStats.of(minutes);
        int n = minutes.size();
        double median = n % 2 == 1 ? minutes.get(n / 2) : (minutes.get(n / 2 - 1) + minutes.get(n / 2)) / 2.0;
        m.put("avgMinutes", stats.mean());
        m.put("medianMinutes", median);
        m.put("minMinutes", minutes.get(0));
        m.put("maxMinutes", minutes.get(n - 1));
        m.put("stdMinutes", stats.stddev());
        m.put("description", "Average session duration: %.1f minutes".formatted(stats.mean()));
        return m;
    }

    static List<Map<String, Object>> seasonalTrends(List<SessionRow> sessions) {
        Map<Season, double[]> acc = new TreeMap<>();
        for (SessionRow s : sessions) {
            double[] countEnergy = acc.computeIfAbsent(Season.of(s.start().getMonthValue()), k -> new double[2]);
            countEnergy[0]++;
            countEnergy[1] += s.energyKwh() == null ? 0.0 : s.energyKwh();
        }
        List<Map<String, Object>> out = new ArrayList<>();
        acc.forEach((season, v) -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("season", season.label);
            m.put("sessionCount", (int) v[0]);
            m.put("totalEnergyKwh", v[1]);
            out.add(m);
        });
        return out;
    }

    /** Meteorological seasons, northern hemisphere. */
    enum Season {
        WINTER("Winter"), SPRING("Spring"), SUMMER("Summer"), FALL("Fall");

        final String label;

        Season(String label) {
            this.label = label;
        }

        static Season of(int month) {
            switch (month) {
                case 12: case 1: case 2: return WINTER;
                case 3: case 4: case 5: return SPRING;
                case 6: case 7: case 8: return SUMMER;
                default: return FALL;
            }
        }
    }
}
