package com.evintel.charging.model;

import java.util.List;

public record NormalizationOutcome<T>(List<T> accepted, List<Rejection> rejected) {

    public int total() {
        return accepted.size() + rejected.size();
    }
}
