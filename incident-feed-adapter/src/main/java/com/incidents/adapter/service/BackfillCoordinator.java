package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.Coordinates;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.repository.IncidentRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Repairs missing durations and coordinates on incidents that were just read.
 * <p>
 * Duration repair is cheap and runs inline. Coordinate repair calls the geocoder and runs as a single
 * background task bounded by a record count and a time budget; while one task runs, new requests are skipped.
 */
@Service
public class BackfillCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BackfillCoordinator.class);

    private final IncidentRepository incidentRepository;
    private final DurationCalculator durationCalculator;
    private final GeocodeCache geocodeCache;
    private final Executor executor;
    private final Clock clock;
    private final int durationBatch;
    private final int coordinateBatch;
    private final Duration coordinateTimeBudget;

    private final AtomicBoolean coordinateTaskRunning = new AtomicBoolean(false);
    private volatile boolean stopped;

    public BackfillCoordinator(IncidentRepository incidentRepository,
                               DurationCalculator durationCalculator,
                               GeocodeCache geocodeCache,
                               @Qualifier("backfillTaskExecutor") Executor executor,
                               IncidentProperties properties,
                               Clock clock) {
        this.incidentRepository = incidentRepository;
        this.durationCalculator = durationCalculator;
        this.geocodeCache = geocodeCache;
        this.executor = executor;
        this.clock = clock;
        this.durationBatch = properties.getBackfill().getDurationBatch();
        this.coordinateBatch = properties.getBackfill().getCoordinateBatch();
        this.coordinateTimeBudget = properties.getBackfill().getCoordinateTimeBudget();
    }

    /**
     * Computes and stores durations for closed incidents that lack one, up to the duration batch size.
     * Rows that get a duration are updated in place.
     *
     * @return number of incidents fixed
     */
    public int backfillDurations(List<IncidentDocument> rows) {
        return backfillDurations(rows, durationBatch);
    }

    int backfillDurations(List<IncidentDocument> rows, int limit) {
        List<IncidentDocument> candidates = rows.stream()
                .filter(BackfillCoordinator::needsDuration)
                .limit(limit)
                .toList();

        int fixed = 0;
        for (IncidentDocument row : candidates) {
            Optional<Integer> minutes = durationFor(row);
            if (minutes.isEmpty()) {
                log.debug("No plausible duration for incident {}, skipped", row.getId());
                continue;
            }
            if (incidentRepository.updateDuration(row.getId(), minutes.get(), clock.instant())) {
                row.setDurationMin(minutes.get());
                fixed++;
            }
        }
        if (fixed > 0) {
            log.info("Duration backfill fixed {} of {} incidents", fixed, candidates.size());
        }
        return fixed;
    }

    /**
     * Starts a background pass that geocodes incidents without coordinates.
     *
     * @return number of incidents that got coordinates; 0 right away when nothing qualifies,
     * a pass is already running or the executor is saturated
     */
    public CompletableFuture<Integer> backfillCoordinates(List<IncidentDocument> rows) {
        List<IncidentDocument> candidates = rows.stream()
                .filter(BackfillCoordinator::needsCoordinates)
                .limit(coordinateBatch)
                .toList();
        if (candidates.isEmpty() || stopped) {
            return CompletableFuture.completedFuture(0);
        }
        if (!coordinateTaskRunning.compareAndSet(false, true)) {
            log.debug("Coordinate backfill already running, skipping {} candidates", candidates.size());
            return CompletableFuture.completedFuture(0);
        }

        try {
            return CompletableFuture.supplyAsync(() -> geocodeAll(candidates), executor)
                    .whenComplete((fixed, error) -> {
                        coordinateTaskRunning.set(false);
                        if (error != null) {
                            log.error("Coordinate backfill failed: {}", error.getMessage(), error);
                        }
                    });
        } catch (RejectedExecutionException e) {
            coordinateTaskRunning.set(false);
            log.warn("Coordinate backfill rejected by executor: {}", e.getMessage());
            return CompletableFuture.completedFuture(0);
        }
    }

    public int getCoordinateBatch() {
        return coordinateBatch;
    }

    public boolean isCoordinateBackfillRunning() {
        return coordinateTaskRunning.get();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
    }

    private int geocodeAll(List<IncidentDocument> candidates) {
        long deadline = System.nanoTime() + coordinateTimeBudget.toNanos();
        int fixed = 0;
        for (IncidentDocument row : candidates) {
            if (stopped || Thread.currentThread().isInterrupted()) {
                log.info("Coordinate backfill cancelled after {} incidents", fixed);
                break;
            }
            if (System.nanoTime() > deadline) {
                log.info("Coordinate backfill time budget of {} used up after {} incidents", coordinateTimeBudget, fixed);
                break;
            }
            Optional<Coordinates> coordinates = geocodeCache.resolve(row.getLocationQuery());
            if (coordinates.isEmpty()) {
                log.debug("No coordinates for incident {} ('{}')", row.getId(), row.getLocationQuery());
                continue;
            }
            Coordinates c = coordinates.get();
            if (incidentRepository.updateCoordinates(row.getId(), c.lat(), c.lon(), clock.instant())) {
                row.setLat(c.lat());
                row.setLon(c.lon());
                fixed++;
            }
        }
        log.info("Coordinate backfill geocoded {} of {} incidents", fixed, candidates.size());
        return fixed;
    }

    /**
     * Start = start time if it parses, else publication time, else first-seen time;
     * end = end time if it gives a plausible value, else closure detection.
     */
    Optional<Integer> durationFor(IncidentDocument row) {
        Instant start = durationCalculator.parse(row.getStartTimeIso())
                .or(() -> durationCalculator.parse(row.getPubDate()))
                .orElse(row.getFirstSeenAt());
        return durationCalculator.parse(row.getEndTimeIso())
                .flatMap(end -> durationCalculator.computeMinutes(start, end))
                .or(() -> durationCalculator.computeMinutes(start, row.getClosedDetectedAt()));
    }

    public static boolean needsDuration(IncidentDocument row) {
        return row.isClosed()
                && row.getClosedDetectedAt() != null
                && (row.getDurationMin() == null || row.getDurationMin() <= 0);
    }

    public static boolean needsCoordinates(IncidentDocument row) {
        String query = row.getLocationQuery();
        return !row.hasCoordinates() && query != null && !query.isBlank();
    }
}
