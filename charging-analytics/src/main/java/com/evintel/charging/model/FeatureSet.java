package com.evintel.charging.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the feature engine for one station and day.
 *
 * @param maxStormSpikeRatio highest session/trailing-average ratio among the day's storm spike
 *                           hours, null when there was no storm spike
 */
public record FeatureSet(EngineeredFeatureRecord daily,
                         List<EngineeredFeatureRecord> hourly,
                         EnergyConsumptionRecord energy,
                         Double maxStormSpikeRatio) {

    /** Daily record first, then hourly records in hour order. */
    public List<EngineeredFeatureRecord> allRecords() {
        List<EngineeredFeatureRecord> all = new ArrayList<>(hourly.size() + 1);
        all.add(daily);
        all.addAll(hourly);
        return all;
    }
}
