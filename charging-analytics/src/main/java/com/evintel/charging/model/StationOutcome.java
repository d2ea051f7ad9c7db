package com.evintel.charging.model;

/**
 * Per-station line of a cycle report.
 */
public record StationOutcome(String stationId,
                             State state,
                             int recordsAccepted,
                             int recordsRejected,
                             int featureRecords,
                             int anomaliesOpened,
                             int anomaliesResolved,
                             String error) {

    public enum State { COMPLETED, FAILED, SKIPPED }

    public static StationOutcome skipped(String stationId, String reason) {
        return new StationOutcome(stationId, State.SKIPPED, 0, 0, 0, 0, 0, reason);
    }

    public static StationOutcome failed(String stationId, int accepted, int rejected, String error) {
        return new StationOutcome(stationId, State.FAILED, accepted, rejected, 0, 0, 0, error);
    }
}
