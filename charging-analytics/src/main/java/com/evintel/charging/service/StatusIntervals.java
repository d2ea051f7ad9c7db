package com.evintel.charging.service;

import com.evintel.charging.model.StatusEvent;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Turns a station's status-history transitions into the intervals a condition held,
 * clipped to a period.
 *
 * The state entering the period is that of the last event at or before its start.
 * An interval still open at the end of the period is truncated to the period end.
 */
final class StatusIntervals {

    private StatusIntervals() {
    }

    static List<Duration> clip(List<StatusEvent> events,
                               Predicate<StatusEvent> condition,
                               LocalDateTime from,
                               LocalDateTime to) {
        List<StatusEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(StatusEvent::getTimestamp)
                .thenComparing(StatusEvent::getStatus)
                .thenComparing(StatusEvent::getAvailablePoints, Comparator.nullsFirst(Comparator.naturalOrder())));

        boolean holding = false;
        for (StatusEvent e : sorted) {
            if (e.getTimestamp().isAfter(from)) break;
            holding = condition.test(e);
        }

        List<Duration> intervals = new ArrayList<>();
        LocalDateTime openedAt = holding ? from : null;
        for (StatusEvent e : sorted) {
            if (!e.getTimestamp().isAfter(from)) continue;
            if (!e.getTimestamp().isBefore(to)) break;
            boolean now = condition.test(e);
            if (now && openedAt == null) {
                openedAt = e.getTimestamp();
            } else if (!now && openedAt != null) {
                intervals.add(Duration.between(openedAt, e.getTimestamp()));
                openedAt = null;
            }
        }
        if (openedAt != null) {
            intervals.add(Duration.between(openedAt, to));
        }
        return intervals;
    }

    /** Mean interval length in minutes, 0 when the condition never held. */
    static double averageMinutes(List<Duration> intervals) {
        if (intervals.isEmpty()) return 0.0;
        long totalSeconds = intervals.stream().mapToLong(Duration::getSeconds).sum();
        return totalSeconds / 60.0 / intervals.size();
    }
}
