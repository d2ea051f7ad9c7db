package com.evintel.charging.service;

import com.evintel.charging.model.AlignedSession;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import com.evintel.charging.model.WeatherObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Joins usage sessions to weather and traffic observations on (station id, hour bucket).
 *
 * Within a bucket the most recent observation strictly before the session start wins.
 * When every observation in the bucket is at or after the start, the earliest of them is used.
 * An empty bucket leaves the correlate null; sessions are never dropped.
 *
 * The output depends only on the input set, never on input order: observations sharing a
 * timestamp are ranked by a total order over their fields, and duplicate session ids
 * collapse to one record before the join.
 */
@Component
@Slf4j
public class TemporalAligner {

    static final Comparator<WeatherObservation> WEATHER_ORDER = Comparator
            .comparing(WeatherObservation::getTimestamp)
            .thenComparing(WeatherObservation::getCondition, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getTemperatureCelsius, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getHumidityPercent, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getPressureHpa, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getWindSpeedMs, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getWindDirectionDegrees, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getPrecipitationMm, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getVisibilityKm, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WeatherObservation::getUvIndex, Comparator.nullsFirst(Comparator.naturalOrder()));

    static final Comparator<TrafficObservation> TRAFFIC_ORDER = Comparator
            .comparing(TrafficObservation::getTimestamp)
            .thenComparing(TrafficObservation::getTrafficDensity, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TrafficObservation::getAverageSpeedKmh, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TrafficObservation::getCongestionLevel, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TrafficObservation::getRoadType, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TrafficObservation::getDistanceToStationKm, Comparator.nullsFirst(Comparator.naturalOrder()));

    /** Which of two records sharing a session id survives: latest end, then most energy. */
    static final Comparator<UsageSession> SESSION_PRECEDENCE = Comparator
            .comparing(UsageSession::getEnd, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingDouble(UsageSession::getEnergyKwh)
            .thenComparing(UsageSession::getStart)
            .thenComparing(UsageSession::getStationId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(UsageSession::getPointId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(UsageSession::getCost, Comparator.nullsFirst(Comparator.naturalOrder()));

    static final Comparator<UsageSession> SESSION_OUTPUT_ORDER = Comparator
            .comparing(UsageSession::getStart)
            .thenComparing(UsageSession::getId);

    /**
     * Align one station's sessions starting in [from, to).
     *
     * @return aligned tuples ordered by session start, then session id
     */
    public List<AlignedSession> align(String stationId,
                                      LocalDateTime from,
                                      LocalDateTime to,
                                      Collection<UsageSession> sessions,
                                      Collection<WeatherObservation> weather,
                                      Collection<TrafficObservation> traffic) {

        Map<LocalDateTime, List<WeatherObservation>> weatherByHour =
                index(weather, stationId, WeatherObservation::getStationId, WeatherObservation::getTimestamp, WEATHER_ORDER);
        Map<LocalDateTime, List<TrafficObservation>> trafficByHour =
                index(traffic, stationId, TrafficObservation::getStationId, TrafficObservation::getTimestamp, TRAFFIC_ORDER);

        List<UsageSession> inWindow = distinctSessions(sessions).stream()
                .filter(s -> stationId.equals(s.getStationId()))
                .filter(s -> !s.getStart().isBefore(from) && s.getStart().isBefore(to))
                .sorted(SESSION_OUTPUT_ORDER)
                .toList();

        List<AlignedSession> aligned = new ArrayList<>(inWindow.size());
        int weatherGaps = 0;
        int trafficGaps = 0;
        for (UsageSession session : inWindow) {
            LocalDateTime bucket = hourBucket(session.getStart());
            WeatherObservation w = pick(weatherByHour.get(bucket), session.getStart(), WeatherObservation::getTimestamp);
            TrafficObservation t = pick(trafficByHour.get(bucket), session.getStart(), TrafficObservation::getTimestamp);
            if (w == null) weatherGaps++;
            if (t == null) trafficGaps++;
            aligned.add(new AlignedSession(session, w, t));
        }

        log.debug("Station {}: aligned {} sessions in [{}, {}), {} without weather, {} without traffic",
                stationId, aligned.size(), from, to, weatherGaps, trafficGaps);
        return aligned;
    }

    public static LocalDateTime hourBucket(LocalDateTime timestamp) {
        return timestamp.truncatedTo(ChronoUnit.HOURS);
    }

    /**
     * Collapse records sharing a session id into one, chosen by {@link #SESSION_PRECEDENCE}.
     * Corrections re-sent by the collector therefore replace the original.
     */
    public static List<UsageSession> distinctSessions(Collection<UsageSession> sessions) {
        Map<String, UsageSession> byId = new HashMap<>();
        for (UsageSession s : sessions) {
            byId.merge(s.getId(), s, (a, b) -> SESSION_PRECEDENCE.compare(a, b) >= 0 ? a : b);
        }
        List<UsageSession> out = new ArrayList<>(byId.values());
        out.sort(SESSION_OUTPUT_ORDER);
        return out;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> Map<LocalDateTime, List<T>> index(Collection<T> observations,
                                                  String stationId,
                                                  Function<T, String> station,
                                                  Function<T, LocalDateTime> timestamp,
                                                  Comparator<T> order) {
        Map<LocalDateTime, List<T>> byHour = new HashMap<>();
        for (T o : observations) {
            if (!stationId.equals(station.apply(o))) continue;
            byHour.computeIfAbsent(hourBucket(timestamp.apply(o)), k -> new ArrayList<>()).add(o);
        }
        byHour.values().forEach(list -> list.sort(order));
        return byHour;
    }

    /** Bucket is sorted ascending by {@code order}. */
    private <T> T pick(List<T> bucket, LocalDateTime sessionStart, Function<T, LocalDateTime> timestamp) {
        if (bucket == null || bucket.isEmpty()) return null;
        T before = null;
        for (T o : bucket) {
            if (timestamp.apply(o).isBefore(sessionStart)) {
                before = o;
            } else {
                break;
            }
        }
        return before != null ? before : bucket.get(0);
    }
}
