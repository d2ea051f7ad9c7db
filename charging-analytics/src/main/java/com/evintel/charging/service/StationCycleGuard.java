package com.evintel.charging.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one in-flight cycle per station. A station stays claimed until its
 * results are persisted or abandoned.
 */
@Component
public class StationCycleGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String stationId) {
        return inFlight.add(stationId);
    }

    public void release(String stationId) {
        inFlight.remove(stationId);
    }

    public boolean isInFlight(String stationId) {
        return inFlight.contains(stationId);
    }
}
