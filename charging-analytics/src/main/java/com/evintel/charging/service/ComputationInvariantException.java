package com.evintel.charging.service;

/**
 * Input reached an engine in a state normalisation should have ruled out,
 * e.g. a session ending before it started. Fatal to the station's cycle only.
 */
public class ComputationInvariantException extends RuntimeException {

    private final String stationId;

    public ComputationInvariantException(String stationId, String message) {
        super("Station " + stationId + ": " + message);
        this.stationId = stationId;
    }

    public String stationId() {
        return stationId;
    }
}
