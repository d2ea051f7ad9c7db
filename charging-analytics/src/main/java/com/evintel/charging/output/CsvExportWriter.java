package com.evintel.charging.output;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.StationCycleResult;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a station's cycle output to CSV files.
 *
 * Output path patterns:
 *   {outputDir}/features_{stationId}_{date}.csv
 *   {outputDir}/anomalies_{stationId}_{date}.csv
 *
 * Files are overwritten on re-run, matching the replace semantics of the store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvExportWriter {

    private final ChargingAnalyticsProperties properties;

    static final String[] FEATURE_HEADERS = {
            "station_id", "date", "hour_of_day", "day_of_week",
            "is_weekend", "is_holiday",
            "avg_downtime_minutes", "energy_per_traffic_density",
            "usage_spike_during_storm", "peak_usage_hours", "avg_wait_time_minutes",
            "total_sessions", "total_energy_kwh"
    };

    static final String[] ANOMALY_HEADERS = {
            "station_id", "anomaly_type", "severity_score",
            "detected_at", "description", "is_resolved", "resolved_at"
    };

    public void write(StationCycleResult result) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        String suffix = safeName(result.stationId()) + "_" + result.date() + ".csv";

        List<String[]> featureRows = new ArrayList<>();
        for (EngineeredFeatureRecord r : result.features().allRecords()) {
            featureRows.add(toRow(r));
        }
        writeFile(outputDir.resolve("features_" + suffix), FEATURE_HEADERS, featureRows);

        List<String[]> anomalyRows = new ArrayList<>();
        result.anomalies().opened().forEach(a -> anomalyRows.add(toRow(a)));
        result.anomalies().resolved().forEach(a -> anomalyRows.add(toRow(a)));
        if (!anomalyRows.isEmpty()) {
            writeFile(outputDir.resolve("anomalies_" + suffix), ANOMALY_HEADERS, anomalyRows);
        }
    }

    private void writeFile(Path outputPath, String[] headers, List<String[]> rows) {
        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile()),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            writer.writeAll(rows);

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(EngineeredFeatureRecord r) {
        return new String[]{
                str(r.getStationId()),
                str(r.getDate()),
                str(r.getHourOfDay()),
                str(r.getDayOfWeek()),
                str(r.isWeekend()),
                str(r.isHoliday()),
                str(r.getAvgDowntimeMinutes()),
                str(r.getEnergyPerTrafficDensity()),
                str(r.isStormUsageSpike()),
                str(r.getPeakUsageHours()),
                str(r.getAvgWaitTimeMinutes()),
                str(r.getTotalSessions()),
                str(r.getTotalEnergyKwh())
        };
    }

    private String[] toRow(AnomalyRecord a) {
        return new String[]{
                str(a.getStationId()),
                a.getType().code(),
                str(a.getSeverityScore()),
                str(a.getDetectedAt()),
                str(a.getDescription()),
                str(a.isResolved()),
                str(a.getResolvedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    /** Station ids come from an external registry; keep them out of path syntax. */
    static String safeName(String stationId) {
        return stationId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
