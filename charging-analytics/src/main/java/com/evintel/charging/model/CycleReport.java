package com.evintel.charging.model;

import java.util.List;

public record CycleReport(CollectionRun run, List<StationOutcome> stations) {
}
