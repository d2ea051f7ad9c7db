package com.evintel.charging.service;

import com.evintel.charging.service.UsagePatternService.SessionRow;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

class UsagePatternServiceTest {

    private static final LocalDate FRIDAY = LocalDate.of(2024, 3, 1);

    @Test
    void peakHoursAreAtLeastOneAndAHalfTimesTheHourlyMean() {
        List<SessionRow> sessions = new ArrayList<>();
        for (int i = 0; i < 4; i++) sessions.add(row(FRIDAY.atTime(9, 10 * i), 30, 5.0));
        sessions.add(row(FRIDAY.atTime(14, 0), 30, 5.0));
        sessions.add(row(FRIDAY.atTime(20, 0), 30, 5.0));

        assertThat(UsagePatternService.peakHours(sessions)).containsExactly(9);
    }

    @Test
    void weekendHeavyWhenMoreSessionsFallOnSaturdayAndSunday() {
        List<SessionRow> sessions = List.of(
                row(FRIDAY.atTime(9, 0), 30, 10.0),
                row(FRIDAY.plusDays(1).atTime(9, 0), 30, 20.0),
                row(FRIDAY.plusDays(2).atTime(9, 0), 30, null));

        Map<String, Object> pattern = UsagePatternService.dayOfWeekPattern(sessions);

        assertThat(pattern)
                .containsEntry("weekdaySessions", 1)
                .containsEntry("weekendSessions", 2)
                .containsEntry("weekdayEnergyKwh", 10.0)
                .containsEntry("weekendEnergyKwh", 20.0)
                .containsEntry("pattern", "weekend_heavy");
    }

    @Test
    void spikeAndLowUsageDaysUseSampleStandardDeviation() {
        List<SessionRow> sessions = new ArrayList<>();
        for (int d = 0; d < 10; d++) {
            for (int s = 0; s < 5; s++) sessions.add(row(FRIDAY.plusDays(d).atTime(8 + s, 0), 30, 1.0));
        }
        sessions.add(row(FRIDAY.plusDays(10).atTime(8, 0), 30, 1.0));

        Map<String, Object> out = new UsagePatternService(null).analyze("ST-1", sessions);

        assertThat(out.get("usageSpikes")).asList().isEmpty();
        assertThat(out.get("lowUsageDays")).asList().singleElement().satisfies(o -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> day = (Map<String, Object>) o;
            assertThat(day.get("date")).isEqualTo(FRIDAY.plusDays(10).toString());
            assertThat(day.get("sessionCount")).isEqualTo(1);
            assertThat((Double) day.get("zScore")).isLessThan(-1.5);
        });

        for (int s = 0; s < 9; s++) sessions.add(row(FRIDAY.plusDays(11).atTime(8, s), 30, 1.0));
        for (int s = 0; s < 20; s++) sessions.add(row(FRIDAY.plusDays(12).atTime(9, s), 30, 1.0));
        out = new UsagePatternService(null).analyze("ST-1", sessions);
        assertThat(out.get("usageSpikes")).asList().singleElement().satisfies(o -> {
            @SuppressWarnings("unchecked")
            Map<String, Object> day = (Map<String, Object>) o;
            assertThat(day.get("sessionCount")).isEqualTo(20);
        });
    }

    @Test
    void flatDailyUsageHasNoOutliers() {
        List<SessionRow> sessions = List.of(
                row(FRIDAY.atTime(9, 0), 30, 1.0),
                row(FRIDAY.plusDays(1).atTime(9, 0), 30, 1.0));

        Map<String, Object> out = new UsagePatternService(null).analyze(null, sessions);

        assertThat(out.get("usageSpikes")).asList().isEmpty();
        assertThat(out.get("lowUsageDays")).asList().isEmpty();
    }

    @Test
    void durationStatsSkipOngoingSessions() {
        List<SessionRow> sessions = List.of(
                row(FRIDAY.atTime(9, 0), 30, 1.0),
                row(FRIDAY.atTime(10, 0), 60, 1.0),
                row(FRIDAY.atTime(11, 0), 90, 1.0),
                new SessionRow(FRIDAY.atTime(12, 0), null, 1.0));

        Map<String, Object> stats = UsagePatternService.durationStats(sessions);

        assertThat(stats)
                .containsEntry("avgMinutes", 60.0)
                .containsEntry("medianMinutes", 60.0)
                .containsEntry("minMinutes", 30.0)
                .containsEntry("maxMinutes", 90.0)
                .containsEntry("stdMinutes", 30.0);
        assertThat(UsagePatternService.durationStats(List.of(new SessionRow(FRIDAY.atTime(9, 0), null, null))))
                .containsOnlyKeys("description");
    }

    @Test
    void seasonsFollowMeteorologicalMonths() {
        List<SessionRow> sessions = List.of(
                row(LocalDate.of(2024, 1, 10).atTime(9, 0), 30, 4.0),
                row(LocalDate.of(2024, 12, 10).atTime(9, 0), 30, 6.0),
                row(LocalDate.of(2024, 3, 10).atTime(9, 0), 30, 2.0));

        List<Map<String, Object>> trends = UsagePatternService.seasonalTrends(sessions);

        assertThat(trends).extracting(m -> m.get("season")).containsExactly("Winter", "Spring");
        assertThat(trends.get(0)).containsEntry("sessionCount", 2).containsEntry("totalEnergyKwh", 10.0);
        assertThat(UsagePatternService.Season.of(11)).isEqualTo(UsagePatternService.Season.FALL);
        assertThat(UsagePatternService.Season.of(6)).isEqualTo(UsagePatternService.Season.SUMMER);
    }

    @Test
    void patternsAreReadFromLandedSessions() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:patterns-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        new JdbcCollectorGateway(jdbcTemplate).ensureSchema();
        insert(jdbcTemplate, "a", "ST-1", FRIDAY.atTime(9, 0), FRIDAY.atTime(9, 40));
        insert(jdbcTemplate, "b", "ST-1", FRIDAY.atTime(18, 0), null);
        insert(jdbcTemplate, "c", "ST-2", FRIDAY.atTime(9, 0), FRIDAY.atTime(10, 0));

        Map<String, Object> out = new UsagePatternService(jdbcTemplate).getUsagePatterns("ST-1");

        assertThat(out).containsEntry("stationId", "ST-1").containsEntry("totalSessions", 2);
        assertThat(out.get("sessionDuration")).asInstanceOf(MAP).containsEntry("avgMinutes", 40.0);
        assertThat(new UsagePatternService(jdbcTemplate).getUsagePatterns(null)).containsEntry("totalSessions", 3);
    }

    private static SessionRow row(LocalDateTime start, int minutes, Double energy) {
        return new SessionRow(start, start.plusMinutes(minutes), energy);
    }

    private static void insert(JdbcTemplate jdbcTemplate, String id, String station, LocalDateTime start, LocalDateTime end) {
        jdbcTemplate.update("INSERT INTO usage_data (id, station_id, point_id, session_start, session_end, "
                + "energy_consumed_kwh) VALUES (?, ?, ?, ?, ?, ?)", id, station, "P1", start, end, 12.0);
    }
}
