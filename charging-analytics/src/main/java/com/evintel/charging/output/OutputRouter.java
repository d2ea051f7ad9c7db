package com.evintel.charging.output;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.CollectionRun;
import com.evintel.charging.model.StationCycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes cycle output to the store and, when enabled, the CSV export.
 *
 * Store writes propagate failures: the station write is the commit point for a station.
 * CSV export is a secondary sink and only logs on failure.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final AnalyticsStore store;
    private final CsvExportWriter csvExportWriter;
    private final ChargingAnalyticsProperties properties;

    public void persist(StationCycleResult result) {
        store.persistStationResult(result);
    }

    public void export(StationCycleResult result) {
        if (!properties.getOutput().getCsv().isEnabled()) return;
        try {
            csvExportWriter.write(result);
        } catch (Exception e) {
            log.warn("CSV export failed for station {} {}: {}", result.stationId(), result.date(), e.getMessage());
        }
    }

    /** Propagates failures so the caller's retry budget applies. */
    public void writeCollectionRun(CollectionRun run) {
        store.writeCollectionRun(run);
    }
}
