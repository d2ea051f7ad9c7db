package com.evintel.charging.model;

import java.util.List;
import java.util.Map;

/**
 * Result of one anomaly pass for a station.
 *
 * @param opened     new open records to insert
 * @param resolved   previously open records now marked resolved
 * @param severities score per evaluated type (suppressed types are absent)
 * @param suppressed reason per type whose baseline was insufficient
 */
public record AnomalyEvaluation(List<AnomalyRecord> opened,
                                List<AnomalyRecord> resolved,
                                Map<AnomalyType, Double> severities,
                                Map<AnomalyType, String> suppressed) {
}
