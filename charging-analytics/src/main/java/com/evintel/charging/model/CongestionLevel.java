package com.evintel.charging.model;

import java.util.Locale;

public enum CongestionLevel {
    LOW, MODERATE, HIGH, SEVERE;

    /** Null for labels outside the known levels. */
    public static CongestionLevel fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
