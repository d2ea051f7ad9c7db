package com.evintel.charging.output;

import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.CollectionRun;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.StationCycleResult;

import java.time.LocalDate;
import java.util.List;

/**
 * Storage collaborator for everything the pipeline produces.
 */
public interface AnalyticsStore {

    /**
     * Write one station's results for one period, all or nothing:
     * feature and energy records replace any existing rows for the same key,
     * opened anomalies are inserted unless the (station, type) is already open,
     * resolved anomalies get their resolved flag and timestamp set.
     */
    void persistStationResult(StationCycleResult result);

    /** Daily feature records with date in [from, to), oldest first. */
    List<EngineeredFeatureRecord> findDailyFeatures(String stationId, LocalDate from, LocalDate to);

    /** Open anomalies for the station, most recently detected first. */
    List<AnomalyRecord> findOpenAnomalies(String stationId);

    void writeCollectionRun(CollectionRun run);
}
