package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.dto.RegeocodeResult;
import com.incidents.adapter.model.Coordinates;
import com.incidents.adapter.model.GeoBounds;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.repository.IncidentRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Store-wide repair passes: startup cleanup, the periodic duration recalculation and the
 * administrative re-geocode of incidents placed outside the region.
 */
@Service
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final int MAX_RECALC_LIMIT = 10_000;
    public static final int DEFAULT_RECALC_LIMIT = 2000;
    public static final int MAX_REGEOCODE_LIMIT = 2000;
    public static final int DEFAULT_REGEOCODE_LIMIT = 200;

    private final IncidentRepository incidentRepository;
    private final BackfillCoordinator backfillCoordinator;
    private final GeocodeCache geocodeCache;
    private final TrackingMarkerService trackingMarkerService;
    private final DurationCalculator durationCalculator;
    private final Executor executor;
    private final GeoBounds bounds;
    private final Clock clock;
    private final int recalcBatch;
    private final Duration regeocodeTimeBudget;

    private volatile boolean stopped;

    public MaintenanceService(IncidentRepository incidentRepository,
                              BackfillCoordinator backfillCoordinator,
                              GeocodeCache geocodeCache,
                              TrackingMarkerService trackingMarkerService,
                              DurationCalculator durationCalculator,
                              @Qualifier("backfillTaskExecutor") Executor executor,
                              IncidentProperties properties,
                              Clock clock) {
        this.incidentRepository = incidentRepository;
        this.backfillCoordinator = backfillCoordinator;
        this.geocodeCache = geocodeCache;
        this.trackingMarkerService = trackingMarkerService;
        this.durationCalculator = durationCalculator;
        this.executor = executor;
        this.bounds = properties.getRegion().toBounds();
        this.clock = clock;
        this.recalcBatch = properties.getMaintenance().getRecalcBatch();
        this.regeocodeTimeBudget = properties.getMaintenance().getRegeocodeTimeBudget();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        try {
            trackingMarkerService.ensureMarker();
            long cleared = incidentRepository.clearDurationsAbove(durationCalculator.getMaxPlausibleMinutes(), clock.instant());
            if (cleared > 0) {
                log.info("Cleared {} implausible durations above {} min", cleared, durationCalculator.getMaxPlausibleMinutes());
            }
        } catch (DataAccessException e) {
            log.error("Startup maintenance failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${incidents.maintenance.interval:PT5M}",
               initialDelayString = "${incidents.maintenance.initial-delay:PT1M}")
    public void scheduledRecalculation() {
        try {
            int fixed = recalculateDurations(recalcBatch);
            log.debug("Scheduled duration recalculation fixed {} incidents", fixed);
        } catch (DataAccessException e) {
            log.error("Scheduled duration recalculation failed: {}", e.getMessage());
        }
    }

    /**
     * Recomputes missing durations of closed incidents across the whole store.
     *
     * @param limit maximum number of incidents examined, clamped to 1..10000
     * @return number of incidents fixed
     */
    public int recalculateDurations(int limit) {
        int bounded = clamp(limit, MAX_RECALC_LIMIT);
        List<IncidentDocument> rows = incidentRepository.findClosedMissingDuration(
                PageRequest.of(0, bounded, Sort.by(Sort.Direction.DESC, "closedDetectedAt")));
        if (rows.isEmpty()) {
            return 0;
        }
        int fixed = backfillCoordinator.backfillDurations(rows, bounded);
        log.info("Duration recalculation: {} candidates, {} fixed", rows.size(), fixed);
        return fixed;
    }

    /**
     * Finds incidents with coordinates outside the region, drops their cached lookup and coordinates,
     * and geocodes them again.
     * <p>
     * Runs on the backfill executor and stops at the re-geocode time budget; incidents not reached are
     * reported as remaining and are picked up by the next sweep.
     *
     * @param limit maximum number of incidents processed, clamped to 1..2000
     * @throws java.util.concurrent.RejectedExecutionException when the backfill executor is saturated
     */
    public CompletableFuture<RegeocodeResult> regeocodeOutsideRegion(int limit) {
        int bounded = clamp(limit, MAX_REGEOCODE_LIMIT);
        return CompletableFuture.supplyAsync(() -> sweepOutsideRegion(bounded), executor);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
    }

    private RegeocodeResult sweepOutsideRegion(int limit) {
        long deadline = System.nanoTime() + regeocodeTimeBudget.toNanos();
        List<IncidentDocument> rows = incidentRepository.findWithCoordinatesOutside(
                bounds.minLat(), bounds.maxLat(), bounds.minLon(), bounds.maxLon(),
                PageRequest.of(0, limit));

        int processed = 0;
        int cacheDeleted = 0;
        int cleared = 0;
        int regeocoded = 0;
        int failed = 0;

        for (IncidentDocument row : rows) {
            if (stopped || Thread.currentThread().isInterrupted()) {
                log.info("Re-geocode sweep cancelled after {} incidents", processed);
                break;
            }
            if (System.nanoTime() > deadline) {
                log.info("Re-geocode time budget of {} used up after {} incidents", regeocodeTimeBudget, processed);
                break;
            }
            processed++;
            String query = row.getLocationQuery();
            if (query != null && !query.isBlank()) {
                geocodeCache.invalidate(query);
                cacheDeleted++;
            }
            if (incidentRepository.clearCoordinates(row.getId(), clock.instant())) {
                cleared++;
            }
            if (query == null || query.isBlank()) {
                failed++;
                continue;
            }
            Optional<Coordinates> coordinates = geocodeCache.resolve(query);
            if (coordinates.isPresent()
                    && incidentRepository.updateCoordinates(row.getId(), coordinates.get().lat(),
                    coordinates.get().lon(), clock.instant())) {
                regeocoded++;
            } else {
                failed++;
            }
        }

        int remaining = rows.size() - processed;
        log.info("Re-geocode outside region: processed={}, cacheDeleted={}, cleared={}, regeocoded={}, failed={}, remaining={}",
                processed, cacheDeleted, cleared, regeocoded, failed, remaining);
        return new RegeocodeResult(processed, cacheDeleted, cleared, regeocoded, failed, remaining);
    }

    private static int clamp(int limit, int max) {
        return Math.max(1, Math.min(limit, max));
    }
}
