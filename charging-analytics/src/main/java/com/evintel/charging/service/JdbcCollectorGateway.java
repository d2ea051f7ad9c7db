package com.evintel.charging.service;

import com.evintel.charging.model.RawChargingPoint;
import com.evintel.charging.model.RawObservationBatch;
import com.evintel.charging.model.RawStation;
import com.evintel.charging.model.RawStatusEvent;
import com.evintel.charging.model.RawTrafficObservation;
import com.evintel.charging.model.RawUsageSession;
import com.evintel.charging.model.RawWeatherObservation;
import com.evintel.charging.model.RegistrySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the landing tables the station, weather, traffic and usage collectors write to.
 *
 * Rows are handed over as raw DTOs, untouched apart from rendering timestamps as
 * ISO-8601 strings; validation belongs to {@link RecordNormalizer}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JdbcCollectorGateway implements CollectorGateway {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring collector landing tables exist...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS charging_stations
            (
                id              VARCHAR(255) PRIMARY KEY,
                name            VARCHAR(500),
                latitude        DOUBLE PRECISION,
                longitude       DOUBLE PRECISION,
                operator        VARCHAR(255),
                network         VARCHAR(255),
                status          VARCHAR(50)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS charging_points
            (
                id              VARCHAR(255) PRIMARY KEY,
                station_id      VARCHAR(255),
                connector_type  VARCHAR(100),
                power_kw        DOUBLE PRECISION,
                status          VARCHAR(50)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS usage_data
            (
                id                  VARCHAR(255),
                station_id          VARCHAR(255),
                point_id            VARCHAR(255),
                session_start       TIMESTAMP,
                session_end         TIMESTAMP,
                energy_consumed_kwh DOUBLE PRECISION,
                cost                DOUBLE PRECISION
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS weather_data
            (
                station_id              VARCHAR(255),
                observed_at             TIMESTAMP,
                temperature_celsius     DOUBLE PRECISION,
                humidity_percent        DOUBLE PRECISION,
                pressure_hpa            DOUBLE PRECISION,
                wind_speed_ms           DOUBLE PRECISION,
                wind_direction_degrees  DOUBLE PRECISION,
                precipitation_mm        DOUBLE PRECISION,
                weather_condition       VARCHAR(100),
                visibility_km           DOUBLE PRECISION,
                uv_index                DOUBLE PRECISION
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS traffic_data
            (
                station_id              VARCHAR(255),
                observed_at             TIMESTAMP,
                traffic_density         DOUBLE PRECISION,
                average_speed_kmh       DOUBLE PRECISION,
                congestion_level        VARCHAR(50),
                road_type               VARCHAR(100),
                distance_to_station_km  DOUBLE PRECISION
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS station_status_history
            (
                station_id          VARCHAR(255),
                observed_at         TIMESTAMP,
                status              VARCHAR(50),
                available_points    INTEGER,
                total_points        INTEGER
            )
        """);

        log.info("Collector landing tables ready.");
    }

    @Override
    public RegistrySnapshot fetchRegistry() {
        List<RawStation> stations = jdbcTemplate.query(
                "SELECT id, name, latitude, longitude, operator, network, status FROM charging_stations ORDER BY id",
                (rs, i) -> RawStation.builder()
                        .id(rs.getString("id"))
                        .name(rs.getString("name"))
                        .latitude(getDouble(rs, "latitude"))
                        .longitude(getDouble(rs, "longitude"))
                        .operator(rs.getString("operator"))
                        .network(rs.getString("network"))
                        .status(rs.getString("status"))
                        .build());

        List<RawChargingPoint> points = jdbcTemplate.query(
                "SELECT id, station_id, connector_type, power_kw, status FROM charging_points ORDER BY id",
                (rs, i) -> RawChargingPoint.builder()
                        .id(rs.getString("id"))
                        .stationId(rs.getString("station_id"))
                        .connectorType(rs.getString("connector_type"))
                        .powerKw(getDouble(rs, "power_kw"))
                        .status(rs.getString("status"))
                        .build());

        log.info("Registry snapshot: {} stations, {} charging points", stations.size(), points.size());
        return new RegistrySnapshot(stations, points);
    }

    @Override
    public RawObservationBatch fetchObservations(String stationId, LocalDateTime from, LocalDateTime to) {
        List<RawUsageSession> sessions = jdbcTemplate.query("""
                SELECT id, station_id, point_id, session_start, session_end, energy_consumed_kwh, cost
                FROM usage_data
                WHERE station_id = ? AND session_start >= ? AND session_start < ?
                """,
                (rs, i) -> RawUsageSession.builder()
                        .id(rs.getString("id"))
                        .stationId(rs.getString("station_id"))
                        .pointId(rs.getString("point_id"))
                        .sessionStart(getTimestamp(rs, "session_start"))
                        .sessionEnd(getTimestamp(rs, "session_end"))
                        .energyConsumedKwh(getDouble(rs, "energy_consumed_kwh"))
                        .cost(getDouble(rs, "cost"))
                        .build(),
                stationId, from, to);

        List<RawWeatherObservation> weather = jdbcTemplate.query("""
                SELECT * FROM weather_data
                WHERE station_id = ? AND observed_at >= ? AND observed_at < ?
                """,
                (rs, i) -> RawWeatherObservation.builder()
                        .stationId(rs.getString("station_id"))
                        .timestamp(getTimestamp(rs, "observed_at"))
                        .temperatureCelsius(getDouble(rs, "temperature_celsius"))
                        .humidityPercent(getDouble(rs, "humidity_percent"))
                        .pressureHpa(getDouble(rs, "pressure_hpa"))
                        .windSpeedMs(getDouble(rs, "wind_speed_ms"))
                        .windDirectionDegrees(getDouble(rs, "wind_direction_degrees"))
                        .precipitationMm(getDouble(rs, "precipitation_mm"))
                        .weatherCondition(rs.getString("weather_condition"))
                        .visibilityKm(getDouble(rs, "visibility_km"))
                        .uvIndex(getDouble(rs, "uv_index"))
                        .build(),
                stationId, from, to);

        List<RawTrafficObservation> traffic = jdbcTemplate.query("""
                SELECT * FROM traffic_data
                WHERE station_id = ? AND observed_at >= ? AND observed_at < ?
                """,
                (rs, i) -> RawTrafficObservation.builder()
                        .stationId(rs.getString("station_id"))
                        .timestamp(getTimestamp(rs, "observed_at"))
                        .trafficDensity(getDouble(rs, "traffic_density"))
                        .averageSpeedKmh(getDouble(rs, "average_speed_kmh"))
                        .congestionLevel(rs.getString("congestion_level"))
                        .roadType(rs.getString("road_type"))
                        .distanceToStationKm(getDouble(rs, "distance_to_station_km"))
                        .build(),
                stationId, from, to);

        List<RawStatusEvent> status = new ArrayList<>(jdbcTemplate.query("""
                SELECT * FROM station_status_history
                WHERE station_id = ? AND observed_at < ?
                ORDER BY observed_at DESC
                LIMIT 1
                """,
                this::mapStatusEvent, stationId, from));
        status.addAll(jdbcTemplate.query("""
                SELECT * FROM station_status_history
                WHERE station_id = ? AND observed_at >= ? AND observed_at < ?
                ORDER BY observed_at
                """,
                this::mapStatusEvent, stationId, from, to));

        log.debug("Station {}: fetched {} sessions, {} weather, {} traffic, {} status rows for [{}, {})",
                stationId, sessions.size(), weather.size(), traffic.size(), status.size(), from, to);
        return new RawObservationBatch(sessions, weather, traffic, status);
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    private RawStatusEvent mapStatusEvent(ResultSet rs, int rowNum) throws SQLException {
        return RawStatusEvent.builder()
                .stationId(rs.getString("station_id"))
                .timestamp(getTimestamp(rs, "observed_at"))
                .status(rs.getString("status"))
                .availablePoints(getInteger(rs, "available_points"))
                .totalPoints(getInteger(rs, "total_points"))
                .build();
    }

    private Double getDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    private Integer getInteger(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private String getTimestamp(ResultSet rs, String column) throws SQLException {
        LocalDateTime ts = rs.getObject(column, LocalDateTime.class);
        return ts == null ? null : ts.toString();
    }
}
