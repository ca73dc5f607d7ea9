package com.incidents.adapter.service;

import com.incidents.adapter.exception.ConcurrentObservationException;
import com.incidents.adapter.exception.InvalidObservationException;
import com.incidents.adapter.exception.StoreUnavailableException;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.Observation;
import com.incidents.adapter.repository.IncidentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Reconciles observations into stored incidents.
 * <p>
 * Each call is one read, one pure merge and one conditional write: an insert for a new id, otherwise a
 * replace guarded by the version that was read. Losing the write to a concurrent writer means
 * re-reading and merging again on top of the winner.
 */
@Service
public class IncidentReconciler {

    private static final Logger log = LoggerFactory.getLogger(IncidentReconciler.class);

    static final int MAX_ATTEMPTS = 5;

    private final IncidentRepository incidentRepository;
    private final IncidentMerger merger;
    private final DurationCalculator durationCalculator;
    private final Clock clock;

    public IncidentReconciler(IncidentRepository incidentRepository, IncidentMerger merger,
                              DurationCalculator durationCalculator, Clock clock) {
        this.incidentRepository = incidentRepository;
        this.merger = merger;
        this.durationCalculator = durationCalculator;
        this.clock = clock;
    }

    /**
     * Merges one observation into the stored incident with the same id.
     *
     * @return the incident as persisted
     * @throws InvalidObservationException     when the observation has no usable id
     * @throws ConcurrentObservationException when concurrent writers won every attempt
     * @throws StoreUnavailableException       when the store cannot be reached
     */
    public IncidentDocument reconcile(Observation observation) {
        if (observation == null) {
            throw new InvalidObservationException("Observation is required");
        }
        Observation normalized = observation.normalized();
        if (normalized.id() == null) {
            throw new InvalidObservationException("Observation id is missing or blank");
        }

        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                IncidentDocument stored = incidentRepository.findById(normalized.id()).orElse(null);
                Instant now = clock.instant();
                IncidentDocument merged = merger.merge(stored, withComputedDuration(stored, normalized, now), now);
                IncidentDocument saved = incidentRepository.save(merged);
                if (stored != null && !stored.isClosed() && saved.isClosed()) {
                    log.info("Incident {} closed, duration={} min", saved.getId(), saved.getDurationMin());
                }
                return saved;
            } catch (DuplicateKeyException | OptimisticLockingFailureException e) {
                log.debug("Concurrent write on incident {} (attempt {}/{}), re-merging",
                        normalized.id(), attempt, MAX_ATTEMPTS);
                lastConflict = e;
            } catch (DataAccessResourceFailureException e) {
                log.error("Incident store unavailable while reconciling {}: {}", normalized.id(), e.getMessage());
                throw new StoreUnavailableException("Incident store unavailable", e);
            }
        }
        log.warn("Giving up on incident {} after {} conflicting attempts", normalized.id(), MAX_ATTEMPTS);
        throw new ConcurrentObservationException(normalized.id(), MAX_ATTEMPTS, lastConflict);
    }

    /**
     * Adds a computed duration when this observation is the first to report closure and carries none.
     */
    private Observation withComputedDuration(IncidentDocument stored, Observation observation, Instant now) {
        boolean wasClosed = stored != null && stored.isClosed();
        if (wasClosed || !observation.reportsClosed() || durationCalculator.isPlausible(observation.durationMin())) {
            return observation;
        }

        String startText = observation.startTimeIso() != null
                ? observation.startTimeIso()
                : stored != null ? stored.getStartTimeIso() : null;
        Instant fallbackStart = stored != null && stored.getFirstSeenAt() != null ? stored.getFirstSeenAt() : now;
        String endText = observation.endTimeIso() != null ? observation.endTimeIso() : now.toString();

        return durationCalculator.computeMinutes(startText, endText, fallbackStart)
                .map(observation::withDurationMin)
                .orElse(observation);
    }
}
