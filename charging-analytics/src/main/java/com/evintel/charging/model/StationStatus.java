package com.evintel.charging.model;

import java.util.Locale;

/**
 * Operational state reported for a station, a charging point, or a status-history event.
 */
public enum StationStatus {
    OPERATIONAL, FAULTED, UNKNOWN, RETIRED;

    /**
     * Map a free-text status label from a collector payload onto a known state.
     * e.g. "Operational", "Available" → OPERATIONAL; "Out of Order" → FAULTED.
     * Anything unrecognised (including null) becomes UNKNOWN.
     */
    public static StationStatus fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String s = label.trim().toLowerCase(Locale.ROOT);
        if (s.contains("retired") || s.contains("removed") || s.contains("decommission")) return RETIRED;
        if (s.contains("fault") || s.contains("out of order") || s.contains("offline")
                || s.contains("not operational") || s.contains("broken")) return FAULTED;
        if (s.contains("operational") || s.contains("available") || s.contains("in use")
                || s.equals("occupied") || s.equals("charging")) return OPERATIONAL;
        return UNKNOWN;
    }
}
