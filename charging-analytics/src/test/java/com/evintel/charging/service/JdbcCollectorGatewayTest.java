package com.evintel.charging.service;

import com.evintel.charging.model.RawObservationBatch;
import com.evintel.charging.model.RawStatusEvent;
import com.evintel.charging.model.RegistrySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class JdbcCollectorGatewayTest {

    private static final LocalDateTime FROM = LocalDateTime.of(2024, 3, 1, 0, 0);
    private static final LocalDateTime TO = FROM.plusDays(1);

    private JdbcTemplate jdbcTemplate;
    private JdbcCollectorGateway gateway;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:landing-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        gateway = new JdbcCollectorGateway(jdbcTemplate);
        gateway.ensureSchema();
    }

    @Test
    void registrySnapshotReadsStationsAndPoints() {
        jdbcTemplate.update("INSERT INTO charging_stations (id, name, latitude, longitude, operator, network, status) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)", "ST-1", "High Street", 51.5, -0.1, "Op", "Net", "Operational");
        jdbcTemplate.update("INSERT INTO charging_stations (id, name, latitude, longitude) VALUES (?, ?, ?, ?)",
                "ST-2", "No coords", null, null);
        jdbcTemplate.update("INSERT INTO charging_points (id, station_id, connector_type, power_kw, status) "
                + "VALUES (?, ?, ?, ?, ?)", "P1", "ST-1", "CCS", 150.0, "Available");

        RegistrySnapshot snapshot = gateway.fetchRegistry();

        assertThat(snapshot.stations()).hasSize(2);
        assertThat(snapshot.stations().get(0).getLatitude()).isEqualTo(51.5);
        assertThat(snapshot.stations().get(1).getLatitude()).isNull();
        assertThat(snapshot.points()).singleElement().satisfies(p -> {
            assertThat(p.getStationId()).isEqualTo("ST-1");
            assertThat(p.getPowerKw()).isEqualTo(150.0);
        });
    }

    @Test
    void observationsAreLimitedToStationAndWindow() {
        insertSession("in", "ST-1", FROM.plusHours(9), FROM.plusHours(10));
        insertSession("ongoing", "ST-1", FROM.plusHours(20), null);
        insertSession("late", "ST-1", TO, TO.plusHours(1));
        insertSession("other", "ST-2", FROM.plusHours(9), FROM.plusHours(10));
        jdbcTemplate.update("INSERT INTO weather_data (station_id, observed_at, temperature_celsius, weather_condition) "
                + "VALUES (?, ?, ?, ?)", "ST-1", FROM.plusHours(9), 11.5, "rain");
        jdbcTemplate.update("INSERT INTO traffic_data (station_id, observed_at, traffic_density, congestion_level) "
                + "VALUES (?, ?, ?, ?)", "ST-1", FROM.minusHours(1), 40.0, "high");

        RawObservationBatch batch = gateway.fetchObservations("ST-1", FROM, TO);

        assertThat(batch.sessions()).extracting(s -> s.getId()).containsExactlyInAnyOrder("in", "ongoing");
        assertThat(batch.sessions()).filteredOn(s -> s.getId().equals("ongoing"))
                .singleElement().satisfies(s -> assertThat(s.getSessionEnd()).isNull());
        assertThat(batch.weather()).singleElement().satisfies(w -> {
            assertThat(w.getWeatherCondition()).isEqualTo("rain");
            assertThat(w.getHumidityPercent()).isNull();
            assertThat(RecordNormalizer.parseTimestamp(w.getTimestamp())).isEqualTo(FROM.plusHours(9));
        });
        assertThat(batch.traffic()).isEmpty();
    }

    @Test
    void statusHistoryIncludesLatestEventBeforeWindow() {
        insertStatus(FROM.minusDays(2), "Operational", 2);
        insertStatus(FROM.minusHours(3), "Faulted", 0);
        insertStatus(FROM.plusHours(2), "Operational", 2);
        insertStatus(TO.plusHours(1), "Faulted", 0);

        RawObservationBatch batch = gateway.fetchObservations("ST-1", FROM, TO);

        assertThat(batch.statusEvents()).extracting(RawStatusEvent::getStatus).containsExactly("Faulted", "Operational");
        assertThat(batch.statusEvents().get(0).getAvailablePoints()).isZero();
    }

    private void insertSession(String id, String station, LocalDateTime start, LocalDateTime end) {
        jdbcTemplate.update("INSERT INTO usage_data (id, station_id, point_id, session_start, session_end, "
                + "energy_consumed_kwh, cost) VALUES (?, ?, ?, ?, ?, ?, ?)", id, station, "P1", start, end, 12.0, null);
    }

    private void insertStatus(LocalDateTime at, String status, int available) {
        jdbcTemplate.update("INSERT INTO station_status_history (station_id, observed_at, status, available_points, "
                + "total_points) VALUES (?, ?, ?, ?, ?)", "ST-1", at, status, available, 2);
    }
}
