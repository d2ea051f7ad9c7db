package com.evintel.charging.service;

import com.evintel.charging.model.ChargingPoint;
import com.evintel.charging.model.CongestionLevel;
import com.evintel.charging.model.NormalizationOutcome;
import com.evintel.charging.model.RawChargingPoint;
import com.evintel.charging.model.RawStation;
import com.evintel.charging.model.RawStatusEvent;
import com.evintel.charging.model.RawTrafficObservation;
import com.evintel.charging.model.RawUsageSession;
import com.evintel.charging.model.RawWeatherObservation;
import com.evintel.charging.model.Rejection;
import com.evintel.charging.model.RejectionReason;
import com.evintel.charging.model.Station;
import com.evintel.charging.model.StationStatus;
import com.evintel.charging.model.StatusEvent;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import com.evintel.charging.model.WeatherObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates raw collector payloads and coerces them into canonical records.
 *
 * Pure: nothing is thrown for bad input. Each call returns the accepted records plus a
 * {@link Rejection} for everything dropped, so the coordinator can account for it.
 *
 * Optional weather/traffic readings outside their plausible range are nulled rather than
 * rejecting the observation. Fields that carry an invariant (coordinates, energy, cost,
 * rated power, session ordering) reject the record.
 */
@Component
@Slf4j
public class RecordNormalizer {

    static final String STATION = "station";
    static final String CHARGING_POINT = "charging_point";
    static final String USAGE_SESSION = "usage_session";
    static final String WEATHER = "weather";
    static final String TRAFFIC = "traffic";
    static final String STATUS_EVENT = "status_event";

    // ── Registry ─────────────────────────────────────────────────────────────

    /**
     * Duplicate station ids collapse to the last occurrence in the snapshot; each replaced
     * row is reported as {@link RejectionReason#SUPERSEDED_DUPLICATE}.
     * Point ids are left empty; attach them once points are normalised.
     */
    public NormalizationOutcome<Station> normalizeStations(List<RawStation> raw) {
        Map<String, Station> byId = new LinkedHashMap<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawStation r : nullSafe(raw)) {
            String id = trimToNull(r.getId());
            if (id == null) {
                rejected.add(reject(STATION, null, RejectionReason.MISSING_REQUIRED_FIELD, "id"));
                continue;
            }
            if (r.getLatitude() == null || r.getLongitude() == null) {
                rejected.add(reject(STATION, id, RejectionReason.MISSING_REQUIRED_FIELD, "latitude/longitude"));
                continue;
            }
            if (!inRange(r.getLatitude(), -90, 90) || !inRange(r.getLongitude(), -180, 180)) {
                rejected.add(reject(STATION, id, RejectionReason.OUT_OF_RANGE,
                        "location " + r.getLatitude() + "," + r.getLongitude()));
                continue;
            }
            Station previous = byId.put(id, Station.builder()
                    .id(id)
                    .name(cap(r.getName(), 500))
                    .latitude(r.getLatitude())
                    .longitude(r.getLongitude())
                    .operator(cap(r.getOperator(), 255))
                    .network(cap(r.getNetwork(), 255))
                    .status(StationStatus.fromLabel(r.getStatus()))
                    .build());
            if (previous != null) {
                rejected.add(reject(STATION, id, RejectionReason.SUPERSEDED_DUPLICATE, "later row with the same id"));
            }
        }
        return new NormalizationOutcome<>(new ArrayList<>(byId.values()), rejected);
    }

    public NormalizationOutcome<ChargingPoint> normalizeChargingPoints(List<RawChargingPoint> raw,
                                                                       Set<String> knownStations) {
        List<ChargingPoint> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawChargingPoint r : nullSafe(raw)) {
            String id = trimToNull(r.getId());
            String stationId = trimToNull(r.getStationId());
            if (id == null || stationId == null) {
                rejected.add(reject(CHARGING_POINT, id, RejectionReason.MISSING_REQUIRED_FIELD,
                        id == null ? "id" : "station_id"));
                continue;
            }
            if (!knownStations.contains(stationId)) {
                rejected.add(reject(CHARGING_POINT, id, RejectionReason.UNKNOWN_STATION_REFERENCE, stationId));
                continue;
            }
            double power = r.getPowerKw() == null ? 0.0 : r.getPowerKw();
            if (power < 0) {
                rejected.add(reject(CHARGING_POINT, id, RejectionReason.OUT_OF_RANGE, "power_kw " + power));
                continue;
            }
            accepted.add(ChargingPoint.builder()
                    .id(id)
                    .stationId(stationId)
                    .connectorType(cap(r.getConnectorType(), 100))
                    .ratedPowerKw(power)
                    .status(StationStatus.fromLabel(r.getStatus()))
                    .build());
        }
        return new NormalizationOutcome<>(accepted, rejected);
    }

    // ── Observations ─────────────────────────────────────────────────────────

    public NormalizationOutcome<UsageSession> normalizeSessions(List<RawUsageSession> raw, Set<String> knownStations) {
        List<UsageSession> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawUsageSession r : nullSafe(raw)) {
            String id = trimToNull(r.getId());
            String stationId = trimToNull(r.getStationId());
            if (id == null || stationId == null || trimToNull(r.getSessionStart()) == null) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.MISSING_REQUIRED_FIELD,
                        id == null ? "id" : stationId == null ? "station_id" : "session_start"));
                continue;
            }
            if (!knownStations.contains(stationId)) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.UNKNOWN_STATION_REFERENCE, stationId));
                continue;
            }
            LocalDateTime start = parseTimestamp(r.getSessionStart());
            LocalDateTime end = trimToNull(r.getSessionEnd()) == null ? null : parseTimestamp(r.getSessionEnd());
            if (start == null || (trimToNull(r.getSessionEnd()) != null && end == null)) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.MALFORMED_TIMESTAMP,
                        start == null ? r.getSessionStart() : r.getSessionEnd()));
                continue;
            }
            if (end != null && !end.isAfter(start)) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.OUT_OF_RANGE, "session_end not after session_start"));
                continue;
            }
            double energy = r.getEnergyConsumedKwh() == null ? 0.0 : r.getEnergyConsumedKwh();
            if (energy < 0 || Double.isNaN(energy)) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.OUT_OF_RANGE, "energy_consumed_kwh " + energy));
                continue;
            }
            if (r.getCost() != null && r.getCost() < 0) {
                rejected.add(reject(USAGE_SESSION, id, RejectionReason.OUT_OF_RANGE, "cost " + r.getCost()));
                continue;
            }
            accepted.add(UsageSession.builder()
                    .id(id)
                    .stationId(stationId)
                    .pointId(trimToNull(r.getPointId()))
                    .start(start)
                    .end(end)
                    .energyKwh(energy)
                    .cost(r.getCost())
                    .build());
        }
        return new NormalizationOutcome<>(accepted, rejected);
    }

    public NormalizationOutcome<WeatherObservation> normalizeWeather(List<RawWeatherObservation> raw,
                                                                     Set<String> knownStations) {
        List<WeatherObservation> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawWeatherObservation r : nullSafe(raw)) {
            String stationId = trimToNull(r.getStationId());
            Rejection problem = checkObservationKey(WEATHER, stationId, r.getTimestamp(), knownStations);
            if (problem != null) {
                rejected.add(problem);
                continue;
            }
            String condition = trimToNull(r.getWeatherCondition());
            accepted.add(WeatherObservation.builder()
                    .stationId(stationId)
                    .timestamp(parseTimestamp(r.getTimestamp()))
                    .temperatureCelsius(clean(r.getTemperatureCelsius(), -50, 60))
                    .humidityPercent(clean(r.getHumidityPercent(), 0, 100))
                    .pressureHpa(clean(r.getPressureHpa(), 800, 1100))
                    .windSpeedMs(clean(r.getWindSpeedMs(), 0, 100))
                    .windDirectionDegrees(clean(r.getWindDirectionDegrees(), 0, 360))
                    .precipitationMm(clean(r.getPrecipitationMm(), 0, 1000))
                    .condition(condition == null ? null : cap(condition.toLowerCase(Locale.ROOT), 100))
                    .visibilityKm(clean(r.getVisibilityKm(), 0, 50))
                    .uvIndex(clean(r.getUvIndex(), 0, 15))
                    .build());
        }
        return new NormalizationOutcome<>(accepted, rejected);
    }

    public NormalizationOutcome<TrafficObservation> normalizeTraffic(List<RawTrafficObservation> raw,
                                                                     Set<String> knownStations) {
        List<TrafficObservation> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawTrafficObservation r : nullSafe(raw)) {
            String stationId = trimToNull(r.getStationId());
            Rejection problem = checkObservationKey(TRAFFIC, stationId, r.getTimestamp(), knownStations);
            if (problem != null) {
                rejected.add(problem);
                continue;
            }
            accepted.add(TrafficObservation.builder()
                    .stationId(stationId)
                    .timestamp(parseTimestamp(r.getTimestamp()))
                    .trafficDensity(clean(r.getTrafficDensity(), 0, 1000))
                    .averageSpeedKmh(clean(r.getAverageSpeedKmh(), 0, 200))
                    .congestionLevel(CongestionLevel.fromLabel(r.getCongestionLevel()))
                    .roadType(cap(r.getRoadType(), 100))
                    .distanceToStationKm(clean(r.getDistanceToStationKm(), 0, 100))
                    .build());
        }
        return new NormalizationOutcome<>(accepted, rejected);
    }

    public NormalizationOutcome<StatusEvent> normalizeStatusEvents(List<RawStatusEvent> raw, Set<String> knownStations) {
        List<StatusEvent> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();

        for (RawStatusEvent r : nullSafe(raw)) {
            String stationId = trimToNull(r.getStationId());
            Rejection problem = checkObservationKey(STATUS_EVENT, stationId, r.getTimestamp(), knownStations);
            if (problem != null) {
                rejected.add(problem);
                continue;
            }
            Integer available = r.getAvailablePoints();
            Integer total = r.getTotalPoints();
            if ((available != null && available < 0) || (total != null && total < 0)
                    || (available != null && total != null && available > total)) {
                rejected.add(reject(STATUS_EVENT, stationId + "@" + r.getTimestamp(), RejectionReason.OUT_OF_RANGE,
                        "available_points " + available + " of " + total));
                continue;
            }
            accepted.add(StatusEvent.builder()
                    .stationId(stationId)
                    .timestamp(parseTimestamp(r.getTimestamp()))
                    .status(StationStatus.fromLabel(r.getStatus()))
                    .availablePoints(available)
                    .totalPoints(total)
                    .build());
        }
        return new NormalizationOutcome<>(accepted, rejected);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Parse a collector timestamp into UTC. Accepts ISO-8601 with or without offset,
     * and the space-separated form databases tend to produce. Null when unparseable.
     */
    static LocalDateTime parseTimestamp(String val) {
        String s = trimToNull(val);
        if (s == null) return null;
        String iso = s.length() > 10 && s.charAt(10) == ' ' ? s.substring(0, 10) + 'T' + s.substring(11) : s;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(iso);
            ZoneId zone = parsed.query(TemporalQueries.zone());
            if (zone == null) {
                return LocalDateTime.from(parsed);
            }
            return ZonedDateTime.from(parsed).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeException e) {
            log.debug("Unparseable timestamp {}: {}", val, e.getMessage());
            return null;
        }
    }

    private Rejection checkObservationKey(String source, String stationId, String timestamp, Set<String> knownStations) {
        String key = stationId + "@" + timestamp;
        if (stationId == null) {
            return reject(source, key, RejectionReason.MISSING_REQUIRED_FIELD, "station_id");
        }
        if (trimToNull(timestamp) == null) {
            return reject(source, key, RejectionReason.MISSING_REQUIRED_FIELD, "timestamp");
        }
        if (!knownStations.contains(stationId)) {
            return reject(source, key, RejectionReason.UNKNOWN_STATION_REFERENCE, stationId);
        }
        if (parseTimestamp(timestamp) == null) {
            return reject(source, key, RejectionReason.MALFORMED_TIMESTAMP, timestamp);
        }
        return null;
    }

    private Double clean(Double value, double min, double max) {
        if (value == null || Double.isNaN(value)) return null;
        return inRange(value, min, max) ? value : null;
    }

    private static boolean inRange(double value, double min, double max) {
        return value >= min && value <= max;
    }

    private static String trimToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    private static String cap(String val, int max) {
        String s = trimToNull(val);
        if (s == null) return null;
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static Rejection reject(String source, String key, RejectionReason reason, String detail) {
        return new Rejection(source, key, reason, detail);
    }
}
