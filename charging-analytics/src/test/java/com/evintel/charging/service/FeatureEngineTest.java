package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AlignedSession;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.FeatureSet;
import com.evintel.charging.model.StationData;
import com.evintel.charging.model.StationStatus;
import com.evintel.charging.model.StatusEvent;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import com.evintel.charging.model.WeatherObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.evintel.charging.TestFixtures.*;
import static org.assertj.core.api.Assertions.*;

class FeatureEngineTest {

    private ChargingAnalyticsProperties properties;
    private FeatureEngine engine;
    private final TemporalAligner aligner = new TemporalAligner();

    @BeforeEach
    void setUp() {
        properties = properties();
        engine = new FeatureEngine(properties, new ConfiguredHolidayCalendar(properties));
    }

    // ── Storm spike ──────────────────────────────────────────────────────────

    @Test
    void stormHourWithNineSessionsAgainstTrailingFiveIsASpike() {
        LocalDate date = LocalDate.of(2024, 3, 8);
        List<UsageSession> sessions = new ArrayList<>();
        for (int d = 1; d <= 7; d++) {
            sessions.addAll(sessionsAt("S2", date.minusDays(d), 14, 5, "hist"));
        }
        sessions.addAll(sessionsAt("S2", date, 14, 9, "cur"));
        List<WeatherObservation> weather = List.of(weather("S2", date.atTime(13, 55), "thunderstorm"),
                weather("S2", date.atTime(14, 0), "thunderstorm"));

        FeatureSet out = compute(data("S2", sessions, weather, List.of(), List.of()), date);

        assertThat(out.daily().isStormUsageSpike()).isTrue();
        assertThat(out.maxStormSpikeRatio()).isCloseTo(1.8, within(1e-9));
        assertThat(out.hourly()).singleElement().satisfies(h -> {
            assertThat(h.getHourOfDay()).isEqualTo(14);
            assertThat(h.isStormUsageSpike()).isTrue();
            assertThat(h.getTotalSessions()).isEqualTo(9);
        });
    }

    @Test
    void sameSessionsWithoutStormWeatherAreNotASpike() {
        LocalDate date = LocalDate.of(2024, 3, 8);
        List<UsageSession> sessions = new ArrayList<>();
        for (int d = 1; d <= 7; d++) {
            sessions.addAll(sessionsAt("S2", date.minusDays(d), 14, 5, "hist"));
        }
        sessions.addAll(sessionsAt("S2", date, 14, 9, "cur"));
        List<WeatherObservation> weather = List.of(weather("S2", date.atTime(13, 30), "rain"));

        FeatureSet out = compute(data("S2", sessions, weather, List.of(), List.of()), date);

        assertThat(out.daily().isStormUsageSpike()).isFalse();
        assertThat(out.maxStormSpikeRatio()).isNull();
    }

    @Test
    void stormWithoutTrailingHistoryNeverSpikes() {
        LocalDate date = LocalDate.of(2024, 3, 8);
        List<UsageSession> sessions = sessionsAt("S2", date, 14, 9, "cur");
        List<WeatherObservation> weather = List.of(weather("S2", date.atTime(14, 0), "storm"));

        FeatureSet out = compute(data("S2", sessions, weather, List.of(), List.of()), date);

        assertThat(out.daily().isStormUsageSpike()).isFalse();
    }

    // ── Energy per traffic ───────────────────────────────────────────────────

    @Test
    void energyPerTrafficIsNullWithoutTrafficObservations() {
        LocalDate date = LocalDate.of(2024, 3, 1);
        List<UsageSession> sessions = sessionsAt("S3", date, 9, 3, "s");

        FeatureSet out = compute(data("S3", sessions, List.of(), List.of(), List.of()), date);

        assertThat(out.daily().getEnergyPerTrafficDensity()).isNull();
        assertThat(out.hourly()).allSatisfy(h -> assertThat(h.getEnergyPerTrafficDensity()).isNull());
        assertThat(out.daily().getTotalEnergyKwh()).isEqualTo(30.0);
    }

    @Test
    void energyPerTrafficDividesByMeanDensityInPeriod() {
        LocalDate date = LocalDate.of(2024, 3, 1);
        List<UsageSession> sessions = sessionsAt("S3", date, 9, 3, "s");
        List<TrafficObservation> traffic = List.of(
                traffic("S3", date.atTime(9, 10), 10.0),
                traffic("S3", date.atTime(18, 0), 20.0),
                traffic("S3", date.minusDays(1).atTime(9, 0), 1000.0));

        FeatureSet out = compute(data("S3", sessions, List.of(), traffic, List.of()), date);

        assertThat(out.daily().getEnergyPerTrafficDensity()).isCloseTo(30.0 / 15.0, within(1e-9));
        assertThat(out.hourly().get(0).getEnergyPerTrafficDensity()).isCloseTo(30.0 / 10.0, within(1e-9));
    }

    @Test
    void zeroMeanDensityIsTreatedAsUndefined() {
        List<TrafficObservation> traffic = List.of(traffic("S3", LocalDateTime.of(2024, 3, 1, 9, 0), 0.0));

        assertThat(FeatureEngine.energyPerTraffic(10.0, traffic,
                LocalDateTime.of(2024, 3, 1, 0, 0), LocalDateTime.of(2024, 3, 2, 0, 0))).isNull();
    }

    // ── Usage aggregates ─────────────────────────────────────────────────────

    @Test
    void peakHoursAndEnergyRollup() {
        LocalDate date = LocalDate.of(2024, 3, 1);
        List<UsageSession> sessions = new ArrayList<>();
        sessions.addAll(sessionsAt("ST-1", date, 8, 5, "a"));
        sessions.addAll(sessionsAt("ST-1", date, 12, 1, "b"));
        sessions.addAll(sessionsAt("ST-1", date, 17, 6, "c"));

        FeatureSet out = compute(data("ST-1", sessions, List.of(), List.of(), List.of()), date);

        assertThat(out.daily().getTotalSessions()).isEqualTo(12);
        assertThat(out.daily().getPeakUsageHours()).isEqualTo(2);
        assertThat(out.hourly()).extracting(EngineeredFeatureRecord::getHourOfDay).containsExactly(8, 12, 17);
        assertThat(out.hourly()).extracting(EngineeredFeatureRecord::getPeakUsageHours).containsExactly(1, 0, 1);
        assertThat(out.energy().getTotalEnergyKwh()).isEqualTo(120.0);
        assertThat(out.energy().getPeakHourEnergyKwh()).isEqualTo(110.0);
        assertThat(out.energy().getOffPeakEnergyKwh()).isEqualTo(10.0);
        assertThat(out.energy().getSessionCount()).isEqualTo(12);
        assertThat(out.energy().getAvgSessionDurationMinutes()).isEqualTo(30.0);
    }

    @Test
    void uniformHoursHaveNoPeaks() {
        int[] counts = new int[24];
        Arrays.fill(counts, 3);

        boolean[] peaks = FeatureEngine.peakHours(counts);

        for (boolean p : peaks) assertThat(p).isFalse();
    }

    @Test
    void emptyDayStillProducesDailyRecord() {
        LocalDate date = LocalDate.of(2024, 3, 1);

        FeatureSet out = compute(data("ST-1", List.of(), List.of(), List.of(), List.of()), date);

        assertThat(out.daily().getTotalSessions()).isZero();
        assertThat(out.daily().getPeakUsageHours()).isZero();
        assertThat(out.hourly()).isEmpty();
        assertThat(out.energy().getAvgSessionDurationMinutes()).isNull();
    }

    @Test
    void hourlyRecordsCanBeSwitchedOff() {
        properties.getFeatures().setHourlyFeatures(false);
        LocalDate date = LocalDate.of(2024, 3, 1);

        FeatureSet out = compute(data("ST-1", sessionsAt("ST-1", date, 8, 2, "a"), List.of(), List.of(), List.of()), date);

        assertThat(out.hourly()).isEmpty();
        assertThat(out.allRecords()).hasSize(1);
    }

    // ── Temporal and availability ────────────────────────────────────────────

    @Test
    void temporalFlags() {
        FeatureSet holiday = compute(data("ST-1", List.of(), List.of(), List.of(), List.of()), LocalDate.of(2024, 7, 4));
        FeatureSet saturday = compute(data("ST-1", List.of(), List.of(), List.of(), List.of()), LocalDate.of(2024, 3, 2));

        assertThat(holiday.daily().isHoliday()).isTrue();
        assertThat(holiday.daily().getDayOfWeek()).isEqualTo(4);
        assertThat(holiday.daily().isWeekend()).isFalse();
        assertThat(saturday.daily().isWeekend()).isTrue();
        assertThat(saturday.daily().getDayOfWeek()).isEqualTo(6);
        assertThat(saturday.daily().isHoliday()).isFalse();
    }

    @Test
    void downtimeAndWaitTimeComeFromStatusHistory() {
        LocalDate date = LocalDate.of(2024, 3, 1);
        LocalDateTime day = date.atStartOfDay();
        List<StatusEvent> status = List.of(
                status("ST-1", day.minusHours(1), StationStatus.FAULTED, 2, 2),
                status("ST-1", day.plusMinutes(30), StationStatus.OPERATIONAL, 2, 2),
                status("ST-1", day.plusHours(12), StationStatus.OPERATIONAL, 0, 2),
                status("ST-1", day.plusHours(12).plusMinutes(20), StationStatus.OPERATIONAL, 2, 2));

        FeatureSet out = compute(data("ST-1", List.of(), List.of(), List.of(), status), date);

        assertThat(out.daily().getAvgDowntimeMinutes()).isEqualTo(30.0);
        assertThat(out.daily().getAvgWaitTimeMinutes()).isEqualTo(20.0);
    }

    @Test
    void recomputingGivesIdenticalRecords() {
        LocalDate date = LocalDate.of(2024, 3, 1);
        StationData data = data("ST-1", sessionsAt("ST-1", date, 8, 4, "a"), List.of(),
                List.of(traffic("ST-1", date.atTime(8, 0), 12.0)), List.of());

        assertThat(compute(data, date)).isEqualTo(compute(data, date));
    }

    private FeatureSet compute(StationData data, LocalDate date) {
        LocalDateTime from = date.atStartOfDay();
        List<AlignedSession> aligned = aligner.align(data.station().getId(), from, from.plusDays(1),
                data.sessions(), data.weather(), data.traffic());
        return engine.compute(data, aligned, date);
    }
}
