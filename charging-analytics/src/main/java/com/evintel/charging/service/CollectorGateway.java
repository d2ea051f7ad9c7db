package com.evintel.charging.service;

import com.evintel.charging.model.RawObservationBatch;
import com.evintel.charging.model.RegistrySnapshot;

import java.time.LocalDateTime;

/**
 * Read side of the external collectors: whatever they have landed for a cycle.
 * Implementations may block on I/O; callers bound them with {@link CollaboratorCalls}.
 */
public interface CollectorGateway {

    RegistrySnapshot fetchRegistry();

    /**
     * Sessions starting, and weather/traffic/status rows stamped, in [from, to).
     * Status history also includes the latest event before {@code from}, so the state
     * entering the window is known.
     */
    RawObservationBatch fetchObservations(String stationId, LocalDateTime from, LocalDateTime to);
}
