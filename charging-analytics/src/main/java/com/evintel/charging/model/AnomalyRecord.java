package com.evintel.charging.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * An anomaly for (station, type). Created open; later marked resolved, never deleted.
 * A new occurrence after resolution is a new record.
 */
@Data
@Builder(toBuilder = true)
public class AnomalyRecord {

    /** Storage id, null until the record has been inserted */
    private Long id;
    private String stationId;
    private AnomalyType type;
    /** Normalised [0,1] */
    private double severityScore;
    private LocalDateTime detectedAt;
    private String description;
    private boolean resolved;
    private LocalDateTime resolvedAt;
}
