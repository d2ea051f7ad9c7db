package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AnomalyEvaluation;
import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.AnomalyType;
import com.evintel.charging.model.EnergyConsumptionRecord;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.FeatureSet;
import com.evintel.charging.model.StationData;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.evintel.charging.TestFixtures.*;
import static org.assertj.core.api.Assertions.*;

class AnomalyEngineTest {

    private static final LocalDate DATE = LocalDate.of(2024, 4, 1);
    private static final LocalDateTime CYCLE = LocalDateTime.of(2024, 4, 1, 23, 0);

    private ChargingAnalyticsProperties properties;
    private AnomalyEngine engine;

    @BeforeEach
    void setUp() {
        properties = properties();
        engine = new AnomalyEngine(properties);
    }

    @Test
    void sessionCountFiveDeviationsAboveBaselineOpensUsageSpikeAtFullSeverity() {
        StationData data = data("S1", List.of(), List.of(), List.of(), List.of());

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S1", 20, false, null),
                baseline("S1", 30), Map.of());

        assertThat(out.opened()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.USAGE_SPIKE);
            assertThat(a.getSeverityScore()).isEqualTo(1.0);
            assertThat(a.getDetectedAt()).isEqualTo(CYCLE);
            assertThat(a.isResolved()).isFalse();
            assertThat(a.getId()).isNull();
        });
        assertThat(out.severities()).containsEntry(AnomalyType.UNUSUAL_DOWNTIME, 0.0)
                .containsEntry(AnomalyType.SEASONAL_DEVIATION, 0.0);
        assertThat(out.suppressed()).containsKey(AnomalyType.TRAFFIC_CORRELATION);
    }

    @Test
    void tooFewBaselinePeriodsSuppressesDetectionHoweverExtreme() {
        StationData data = data("S1", List.of(), List.of(), List.of(), List.of());

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S1", 1_000, false, null),
                baseline("S1", 6), Map.of());

        assertThat(out.opened()).extracting(AnomalyRecord::getType).doesNotContain(AnomalyType.USAGE_SPIKE);
        assertThat(out.suppressed()).containsKeys(AnomalyType.USAGE_SPIKE, AnomalyType.UNUSUAL_DOWNTIME);
        assertThat(out.severities()).doesNotContainKey(AnomalyType.USAGE_SPIKE);
    }

    @Test
    void alreadyOpenAnomalyIsNotDuplicated() {
        StationData data = data("S1", List.of(), List.of(), List.of(), List.of());
        AnomalyRecord open = openRecord("S1", AnomalyType.USAGE_SPIKE);

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S1", 20, false, null),
                baseline("S1", 30), Map.of(AnomalyType.USAGE_SPIKE, open));

        assertThat(out.opened()).isEmpty();
        assertThat(out.resolved()).isEmpty();
    }

    @Test
    void openAnomalyResolvesWhenConditionNoLongerHolds() {
        StationData data = data("S1", List.of(), List.of(), List.of(), List.of());
        AnomalyRecord open = openRecord("S1", AnomalyType.USAGE_SPIKE);

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S1", 10, false, null),
                baseline("S1", 30), Map.of(AnomalyType.USAGE_SPIKE, open));

        assertThat(out.opened()).isEmpty();
        assertThat(out.resolved()).singleElement().satisfies(a -> {
            assertThat(a.getId()).isEqualTo(7L);
            assertThat(a.isResolved()).isTrue();
            assertThat(a.getResolvedAt()).isEqualTo(CYCLE);
            assertThat(a.getDetectedAt()).isEqualTo(open.getDetectedAt());
        });
        assertThat(open.isResolved()).isFalse();
    }

    @Test
    void suppressedTypeLeavesOpenRecordAlone() {
        StationData data = data("S1", List.of(), List.of(), List.of(), List.of());
        AnomalyRecord open = openRecord("S1", AnomalyType.USAGE_SPIKE);

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S1", 10, false, null),
                baseline("S1", 3), Map.of(AnomalyType.USAGE_SPIKE, open));

        assertThat(out.resolved()).isEmpty();
    }

    @Test
    void stormSpikeOpensWeatherRelatedScaledByRatio() {
        StationData data = data("S2", List.of(), List.of(), List.of(), List.of());

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S2", 10, true, 1.8),
                baseline("S2", 30), Map.of());

        assertThat(out.opened()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.WEATHER_RELATED);
            assertThat(a.getSeverityScore()).isCloseTo(0.9, within(1e-9));
        });
    }

    @Test
    void strongSessionTrafficCorrelationIsFlagged() {
        List<UsageSession> sessions = new ArrayList<>();
        List<TrafficObservation> traffic = new ArrayList<>();
        for (int h = 1; h <= 10; h++) {
            sessions.addAll(sessionsAt("S4", DATE, h, h, "s"));
            traffic.add(traffic("S4", DATE.atTime(h, 5), h * 10.0));
        }
        StationData data = data("S4", sessions, List.of(), traffic, List.of());

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S4", 10, false, null),
                baseline("S4", 30), Map.of());

        assertThat(out.severities().get(AnomalyType.TRAFFIC_CORRELATION)).isCloseTo(1.0, within(1e-9));
        assertThat(out.opened()).extracting(AnomalyRecord::getType).contains(AnomalyType.TRAFFIC_CORRELATION);
    }

    @Test
    void trafficCorrelationNeedsEnoughHours() {
        List<TrafficObservation> traffic = List.of(
                traffic("S4", DATE.atTime(1, 0), 5.0),
                traffic("S4", DATE.atTime(2, 0), 9.0));
        StationData data = data("S4", sessionsAt("S4", DATE, 1, 2, "s"), List.of(), traffic, List.of());

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, current("S4", 2, false, null),
                baseline("S4", 30), Map.of());

        assertThat(out.suppressed()).containsKey(AnomalyType.TRAFFIC_CORRELATION);
    }

    @Test
    void seasonalDeviationComparesSameWeekday() {
        List<EngineeredFeatureRecord> history = new ArrayList<>();
        for (int d = 1; d <= 30; d++) {
            LocalDate day = DATE.minusDays(d);
            double energy = d % 7 == 0 ? 50.0 + d : 500.0;
            history.add(daily("S5", day, 10, 0.0, energy));
        }
        StationData data = data("S5", List.of(), List.of(), List.of(), List.of());
        EngineeredFeatureRecord today = daily("S5", DATE, 10, 0.0, 200.0);

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, featureSet(today, null), history, Map.of());

        assertThat(out.opened()).extracting(AnomalyRecord::getType).containsExactly(AnomalyType.SEASONAL_DEVIATION);
    }

    @Test
    void seasonalLookbackReachesPastTheZScoreWindow() {
        properties.getAnomaly().setBaselineDays(14);
        List<EngineeredFeatureRecord> history = new ArrayList<>();
        for (int d = 1; d <= 35; d++) {
            double energy = d % 7 == 0 ? 50.0 + d : 500.0;
            history.add(daily("S5", DATE.minusDays(d), 10, 0.0, energy));
        }
        StationData data = data("S5", List.of(), List.of(), List.of(), List.of());
        EngineeredFeatureRecord today = daily("S5", DATE, 10, 0.0, 200.0);

        AnomalyEvaluation out = engine.evaluate(data, DATE, CYCLE, featureSet(today, null), history, Map.of());

        assertThat(out.suppressed()).doesNotContainKey(AnomalyType.SEASONAL_DEVIATION);
        assertThat(out.opened()).extracting(AnomalyRecord::getType).contains(AnomalyType.SEASONAL_DEVIATION);
        assertThat(out.opened()).filteredOn(a -> a.getType() == AnomalyType.SEASONAL_DEVIATION)
                .singleElement().satisfies(a -> assertThat(a.getDescription()).contains("n=4"));
    }

    @Test
    void downtimeFarAboveBaselineOpensThenNormalDayResolves() {
        List<EngineeredFeatureRecord> history = new ArrayList<>();
        for (int d = 1; d <= 10; d++) {
            history.add(daily("S6", DATE.minusDays(d), 10, d % 2 == 0 ? 20.0 : 40.0, 100.0));
        }
        StationData data = data("S6", List.of(), List.of(), List.of(), List.of());

        AnomalyEvaluation outage = engine.evaluate(data, DATE, CYCLE,
                featureSet(daily("S6", DATE, 10, 300.0, 100.0), null), history, Map.of());

        assertThat(outage.opened()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.UNUSUAL_DOWNTIME);
            assertThat(a.getSeverityScore()).isEqualTo(1.0);
            assertThat(a.getDescription()).contains("downtime");
        });

        AnomalyRecord stored = outage.opened().get(0).toBuilder().id(11L).build();
        AnomalyEvaluation recovered = engine.evaluate(data, DATE.plusDays(1), CYCLE.plusDays(1),
                featureSet(daily("S6", DATE.plusDays(1), 10, 30.0, 100.0), null), history,
                Map.of(AnomalyType.UNUSUAL_DOWNTIME, stored));

        assertThat(recovered.opened()).isEmpty();
        assertThat(recovered.resolved()).singleElement().satisfies(a -> {
            assertThat(a.getId()).isEqualTo(11L);
            assertThat(a.getType()).isEqualTo(AnomalyType.UNUSUAL_DOWNTIME);
            assertThat(a.getResolvedAt()).isEqualTo(CYCLE.plusDays(1));
        });
        assertThat(recovered.severities().get(AnomalyType.UNUSUAL_DOWNTIME)).isLessThan(0.6);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** 30 days alternating 8 and 12 sessions: mean 10, stddev about 2. */
    private List<EngineeredFeatureRecord> baseline(String stationId, int days) {
        List<EngineeredFeatureRecord> history = new ArrayList<>();
        for (int d = 1; d <= days; d++) {
            history.add(daily(stationId, DATE.minusDays(d), d % 2 == 0 ? 8 : 12, 0.0, 100.0));
        }
        return history;
    }

    private FeatureSet current(String stationId, int sessions, boolean stormSpike, Double ratio) {
        EngineeredFeatureRecord today = EngineeredFeatureRecord.builder()
                .stationId(stationId)
                .date(DATE)
                .dayOfWeek(DATE.getDayOfWeek().getValue())
                .totalSessions(sessions)
                .totalEnergyKwh(100.0)
                .stormUsageSpike(stormSpike)
                .build();
        return featureSet(today, ratio);
    }

    private FeatureSet featureSet(EngineeredFeatureRecord today, Double ratio) {
        EnergyConsumptionRecord energy = EnergyConsumptionRecord.builder()
                .stationId(today.getStationId())
                .date(today.getDate())
                .totalEnergyKwh(today.getTotalEnergyKwh())
                .sessionCount(today.getTotalSessions())
                .build();
        return new FeatureSet(today, List.of(), energy, ratio);
    }

    private AnomalyRecord openRecord(String stationId, AnomalyType type) {
        return AnomalyRecord.builder()
                .id(7L)
                .stationId(stationId)
                .type(type)
                .severityScore(0.9)
                .detectedAt(CYCLE.minusDays(2))
                .description("earlier")
                .build();
    }
}
