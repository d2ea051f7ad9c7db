package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One closed (or still running) charging session. Timestamps are UTC.
 */
@Value
@Builder
public class UsageSession {

    String id;
    String stationId;
    String pointId;
    LocalDateTime start;
    /** Null while the session is ongoing; otherwise strictly after start */
    LocalDateTime end;
    double energyKwh;
    /** Null when the collector reported no cost */
    Double cost;

    public boolean isOngoing() {
        return end == null;
    }

    /** Derived end − start, null for ongoing sessions. */
    public Duration getDuration() {
        return end == null ? null : Duration.between(start, end);
    }
}
