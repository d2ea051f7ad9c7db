package com.evintel.charging.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Summary of one collection cycle, written once when the cycle completes.
 * Stored in the data_collection_log table.
 */
@Data
@Builder
public class CollectionRun {

    private String runId;           // UUID
    private String dataSource;
    private String collectionType;
    private String periodDate;      // yyyy-MM-dd processed by the cycle
    private int recordsProcessed;   // accepted after normalisation
    private int recordsRejected;
    private int stationsProcessed;
    private int stationsFailed;
    private int stationsSkipped;
    private RunStatus status;
    private String errorDetail;     // null on success
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
