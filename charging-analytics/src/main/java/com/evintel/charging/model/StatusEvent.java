package com.evintel.charging.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A status-history transition: the station's state and point availability as of {@code timestamp}.
 * The state holds until the next event for the same station.
 */
@Value
@Builder
public class StatusEvent {

    String stationId;
    LocalDateTime timestamp;
    StationStatus status;
    Integer availablePoints;
    Integer totalPoints;

    public boolean isOperational() {
        return status == StationStatus.OPERATIONAL;
    }

    /** Every point occupied or out of service, so a new arrival has to wait. */
    public boolean isFullyOccupied() {
        return availablePoints != null && availablePoints == 0;
    }
}
