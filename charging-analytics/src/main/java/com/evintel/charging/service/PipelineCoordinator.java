package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AlignedSession;
import com.evintel.charging.model.AnomalyEvaluation;
import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.AnomalyType;
import com.evintel.charging.model.ChargingPoint;
import com.evintel.charging.model.CollectionRun;
import com.evintel.charging.model.CycleReport;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.FeatureSet;
import com.evintel.charging.model.NormalizationOutcome;
import com.evintel.charging.model.RawObservationBatch;
import com.evintel.charging.model.RegistrySnapshot;
import com.evintel.charging.model.Rejection;
import com.evintel.charging.model.RunStatus;
import com.evintel.charging.model.Station;
import com.evintel.charging.model.StationCycleResult;
import com.evintel.charging.model.StationData;
import com.evintel.charging.model.StationOutcome;
import com.evintel.charging.model.StationStatus;
import com.evintel.charging.model.StatusEvent;
import com.evintel.charging.model.TrafficObservation;
import com.evintel.charging.model.UsageSession;
import com.evintel.charging.model.WeatherObservation;
import com.evintel.charging.output.AnalyticsStore;
import com.evintel.charging.output.OutputRouter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Orchestrates one collection cycle for a calendar date.
 *
 * Per station: fetch observations, normalise, align the day, compute features,
 * score anomalies against stored history, then persist in one transaction.
 * A station that fails is recorded in the cycle report and the rest carry on.
 * The cycle always ends with a CollectionRun written to the store.
 */
@Service
@Slf4j
public class PipelineCoordinator {

    static final String DATA_SOURCE = "collector-gateway";
    static final String COLLECTION_TYPE = "feature_anomaly_cycle";

    private static final String REGISTRY = "collector:registry";
    private static final String STORE = "analytics-store";

    private final CollectorGateway gateway;
    private final RecordNormalizer normalizer;
    private final TemporalAligner aligner;
    private final FeatureEngine featureEngine;
    private final AnomalyEngine anomalyEngine;
    private final AnalyticsStore store;
    private final OutputRouter outputRouter;
    private final CollaboratorCalls calls;
    private final StationCycleGuard guard;
    private final ChargingAnalyticsProperties properties;
    private final Clock clock;

    private final ExecutorService stationExecutor;
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    public PipelineCoordinator(CollectorGateway gateway,
                               RecordNormalizer normalizer,
                               TemporalAligner aligner,
                               FeatureEngine featureEngine,
                               AnomalyEngine anomalyEngine,
                               AnalyticsStore store,
                               OutputRouter outputRouter,
                               CollaboratorCalls calls,
                               StationCycleGuard guard,
                               ChargingAnalyticsProperties properties,
                               Clock clock) {
        this.gateway = gateway;
        this.normalizer = normalizer;
        this.aligner = aligner;
        this.featureEngine = featureEngine;
        this.anomalyEngine = anomalyEngine;
        this.store = store;
        this.outputRouter = outputRouter;
        this.calls = calls;
        this.guard = guard;
        this.properties = properties;
        this.clock = clock;

        AtomicInteger threads = new AtomicInteger();
        this.stationExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getCollection().getParallelism()),
                r -> new Thread(r, "station-cycle-" + threads.incrementAndGet()));
    }

    /**
     * Process today's (UTC) data. Used by the scheduled run; repeated runs during
     * the day replace the day's features as more sessions arrive.
     */
    public CycleReport runLatest() {
        return runCycle(LocalDate.now(clock));
    }

    public CycleReport runCycle(LocalDate date) {
        return runCycle(date, LocalDateTime.now(clock));
    }

    /**
     * Process every active station for {@code date}.
     *
     * @param cycleTimestamp stamped on anomalies opened or resolved by this cycle
     */
    public CycleReport runCycle(LocalDate date, LocalDateTime cycleTimestamp) {
        log.info("Starting cycle for {}", date);

        CollectionRun run = CollectionRun.builder()
                .runId(UUID.randomUUID().toString())
                .dataSource(DATA_SOURCE)
                .collectionType(COLLECTION_TYPE)
                .periodDate(date.toString())
                .startedAt(LocalDateTime.now(clock))
                .status(RunStatus.FAILED)
                .build();
        List<StationOutcome> outcomes = new ArrayList<>();

        try {
            List<Station> stations = loadRegistry(run);
            outcomes.addAll(processStations(stations, date, cycleTimestamp));
            summarise(run, outcomes);

        } catch (Exception e) {
            log.error("Cycle for {} failed: {}", date, e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setErrorDetail(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            recordRun(run);
        }

        CycleReport report = new CycleReport(run, List.copyOf(outcomes));
        lastReport.set(report);
        log.info("Cycle for {} finished {}: {} stations ok, {} failed, {} skipped, {} records, {} rejected",
                date, run.getStatus(), run.getStationsProcessed(), run.getStationsFailed(),
                run.getStationsSkipped(), run.getRecordsProcessed(), run.getRecordsRejected());
        return report;
    }

    /**
     * Run one cycle per day for the last {@code days} days up to and including today,
     * oldest first so each day's baseline includes the days before it.
     */
    public List<CycleReport> backfill(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, was " + days);
        }
        LocalDate today = LocalDate.now(clock);
        log.info("Starting backfill of {} days ending {}", days, today);

        List<CycleReport> reports = new ArrayList<>(days);
        for (LocalDate d = today.minusDays(days - 1L); !d.isAfter(today); d = d.plusDays(1)) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Backfill interrupted before {}", d);
                break;
            }
            reports.add(runCycle(d));
        }
        log.info("Backfill complete: {} cycles", reports.size());
        return reports;
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    @PreDestroy
    public void shutdown() {
        stationExecutor.shutdownNow();
    }

    // ── Registry ─────────────────────────────────────────────────────────────

    private List<Station> loadRegistry(CollectionRun run) {
        RegistrySnapshot snapshot = calls.call(REGISTRY, gateway::fetchRegistry);

        NormalizationOutcome<Station> stations = normalizer.normalizeStations(snapshot.stations());
        Set<String> known = stations.accepted().stream().map(Station::getId).collect(Collectors.toSet());
        NormalizationOutcome<ChargingPoint> points = normalizer.normalizeChargingPoints(snapshot.points(), known);
        logRejections("registry", stations.rejected());
        logRejections("registry", points.rejected());

        run.setRecordsProcessed(stations.accepted().size() + points.accepted().size());
        run.setRecordsRejected(stations.rejected().size() + points.rejected().size());

        Map<String, Set<String>> pointsByStation = points.accepted().stream()
                .collect(Collectors.groupingBy(ChargingPoint::getStationId,
                        Collectors.mapping(ChargingPoint::getId, Collectors.toCollection(TreeSet::new))));

        List<Station> active = new ArrayList<>();
        for (Station s : stations.accepted()) {
            if (s.getStatus() == StationStatus.RETIRED) {
                log.debug("Station {} is retired, not processed", s.getId());
                continue;
            }
            active.add(s.withPointIds(pointsByStation.getOrDefault(s.getId(), Set.of())));
        }
        log.info("Registry: {} stations ({} active), {} points, {} rejected",
                stations.accepted().size(), active.size(), points.accepted().size(), run.getRecordsRejected());
        return active;
    }

    // ── Stations ─────────────────────────────────────────────────────────────

    private List<StationOutcome> processStations(List<Station> stations, LocalDate date, LocalDateTime cycleTimestamp) {
        Map<String, Future<StationOutcome>> futures = new LinkedHashMap<>();
        for (Station station : stations) {
            futures.put(station.getId(), stationExecutor.submit(() -> processStation(station, date, cycleTimestamp)));
        }

        List<StationOutcome> outcomes = new ArrayList<>(futures.size());
        boolean interrupted = false;
        for (Map.Entry<String, Future<StationOutcome>> e : futures.entrySet()) {
            if (interrupted) {
                // Not started stations are abandoned; started ones roll back or commit whole.
                e.getValue().cancel(true);
                outcomes.add(StationOutcome.failed(e.getKey(), 0, 0, "cycle cancelled"));
                continue;
            }
            try {
                outcomes.add(e.getValue().get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                interrupted = true;
                e.getValue().cancel(true);
                outcomes.add(StationOutcome.failed(e.getKey(), 0, 0, "cycle cancelled"));
            } catch (CancellationException ex) {
                outcomes.add(StationOutcome.failed(e.getKey(), 0, 0, "cycle cancelled"));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.error("Station {} failed unexpectedly: {}", e.getKey(), cause.getMessage(), cause);
                outcomes.add(StationOutcome.failed(e.getKey(), 0, 0, describe(cause)));
            }
        }
        return outcomes;
    }

    StationOutcome processStation(Station station, LocalDate date, LocalDateTime cycleTimestamp) {
        String stationId = station.getId();
        if (!guard.tryAcquire(stationId)) {
            log.warn("Station {}: previous cycle still in flight, skipping {}", stationId, date);
            return StationOutcome.skipped(stationId, "previous cycle still in flight");
        }

        int accepted = 0;
        int rejected = 0;
        try {
            int baselineDays = properties.getAnomaly().getBaselineDays();
            int historyDays = Math.max(baselineDays, properties.getFeatures().getStormTrailingDays());
            LocalDateTime dayStart = date.atStartOfDay();
            LocalDateTime from = date.minusDays(historyDays).atStartOfDay();
            LocalDateTime to = dayStart.plusDays(1);

            RawObservationBatch batch = calls.call("collector:" + stationId,
                    () -> gateway.fetchObservations(stationId, from, to));

            Set<String> known = Set.of(stationId);
            NormalizationOutcome<UsageSession> sessions = normalizer.normalizeSessions(batch.sessions(), known);
            NormalizationOutcome<WeatherObservation> weather = normalizer.normalizeWeather(batch.weather(), known);
            NormalizationOutcome<TrafficObservation> traffic = normalizer.normalizeTraffic(batch.traffic(), known);
            NormalizationOutcome<StatusEvent> status = normalizer.normalizeStatusEvents(batch.statusEvents(), known);

            accepted = sessions.accepted().size() + weather.accepted().size()
                    + traffic.accepted().size() + status.accepted().size();
            rejected = sessions.rejected().size() + weather.rejected().size()
                    + traffic.rejected().size() + status.rejected().size();
            logRejections(stationId, sessions.rejected());
            logRejections(stationId, weather.rejected());
            logRejections(stationId, traffic.rejected());
            logRejections(stationId, status.rejected());

            StationData data = new StationData(station,
                    TemporalAligner.distinctSessions(sessions.accepted()),
                    weather.accepted(), traffic.accepted(), status.accepted());

            List<AlignedSession> aligned = aligner.align(stationId, dayStart, to,
                    data.sessions(), data.weather(), data.traffic());
            FeatureSet features = featureEngine.compute(data, aligned, date);

            int lookbackDays = Math.max(baselineDays, properties.getAnomaly().getSeasonalLookbackWeeks() * 7);
            List<EngineeredFeatureRecord> history = calls.call(STORE,
                    () -> store.findDailyFeatures(stationId, date.minusDays(lookbackDays), date));
            Map<AnomalyType, AnomalyRecord> open = openByType(calls.call(STORE,
                    () -> store.findOpenAnomalies(stationId)));

            AnomalyEvaluation anomalies = anomalyEngine.evaluate(data, date, cycleTimestamp, features, history, open);
            StationCycleResult result = new StationCycleResult(stationId, date, features, anomalies);

            if (Thread.currentThread().isInterrupted()) {
                log.warn("Station {}: cycle cancelled before persistence, nothing written for {}", stationId, date);
                return StationOutcome.failed(stationId, accepted, rejected, "cycle cancelled");
            }
            calls.write(STORE, () -> outputRouter.persist(result));
            outputRouter.export(result);

            log.info("Station {} {}: {} sessions, {} feature records, {} anomalies opened, {} resolved",
                    stationId, date, features.daily().getTotalSessions(), features.allRecords().size(),
                    anomalies.opened().size(), anomalies.resolved().size());
            return new StationOutcome(stationId, StationOutcome.State.COMPLETED, accepted, rejected,
                    features.allRecords().size(), anomalies.opened().size(), anomalies.resolved().size(), null);

        } catch (Exception e) {
            log.error("Station {} {} failed: {}", stationId, date, e.getMessage(), e);
            return StationOutcome.failed(stationId, accepted, rejected, describe(e));
        } finally {
            guard.release(stationId);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** Run metadata never changes the cycle's outcome. */
    private void recordRun(CollectionRun run) {
        try {
            calls.write(STORE, () -> outputRouter.writeCollectionRun(run));
        } catch (CollaboratorUnavailableException e) {
            log.warn("Failed to write collection run metadata {}: {}", run.getRunId(), e.getMessage());
        }
    }

    /** Latest open record per type. The store lists most recent first. */
    static Map<AnomalyType, AnomalyRecord> openByType(List<AnomalyRecord> open) {
        Map<AnomalyType, AnomalyRecord> byType = new EnumMap<>(AnomalyType.class);
        for (AnomalyRecord a : open) {
            byType.putIfAbsent(a.getType(), a);
        }
        return byType;
    }

    private void summarise(CollectionRun run, List<StationOutcome> outcomes) {
        int ok = 0;
        int failed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (StationOutcome o : outcomes) {
            run.setRecordsProcessed(run.getRecordsProcessed() + o.recordsAccepted());
            run.setRecordsRejected(run.getRecordsRejected() + o.recordsRejected());
            switch (o.state()) {
                case COMPLETED -> ok++;
                case FAILED -> {
                    failed++;
                    errors.add(o.stationId() + ": " + o.error());
                }
                case SKIPPED -> skipped++;
            }
        }
        run.setStationsProcessed(ok);
        run.setStationsFailed(failed);
        run.setStationsSkipped(skipped);

        if (failed == 0 && skipped == 0) {
            run.setStatus(RunStatus.SUCCESS);
        } else if (ok == 0) {
            run.setStatus(RunStatus.FAILED);
        } else {
            run.setStatus(RunStatus.PARTIAL);
        }
        run.setErrorDetail(errors.isEmpty() ? null : String.join("; ", errors));
    }

    private void logRejections(String scope, List<Rejection> rejections) {
        if (rejections.isEmpty()) return;
        log.warn("{}: {} records rejected", scope, rejections.size());
        rejections.forEach(r -> log.debug("{}: rejected {}", scope, r));
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
