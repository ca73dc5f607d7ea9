package com.incidents.adapter.service;

import com.incidents.adapter.exception.InvalidObservationException;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.IngestionResult;
import com.incidents.adapter.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for observation batches pushed by feed readers.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final IncidentReconciler reconciler;
    private final BackfillCoordinator backfillCoordinator;

    public IngestionService(IncidentReconciler reconciler, BackfillCoordinator backfillCoordinator) {
        this.reconciler = reconciler;
        this.backfillCoordinator = backfillCoordinator;
    }

    /**
     * Reconciles each observation in order. Invalid observations are counted and skipped;
     * store failures abort the batch.
     */
    public IngestionResult ingest(String source, List<Observation> observations) {
        String label = source == null || source.isBlank() ? "unknown" : source.trim();
        if (observations == null || observations.isEmpty()) {
            log.info("Empty batch from {}", label);
            return IngestionResult.empty(label);
        }

        log.info("Ingesting {} observations from {}...", observations.size(), label);

        List<IncidentDocument> touched = new ArrayList<>();
        int rejected = 0;
        int closedInBatch = 0;

        for (Observation observation : observations) {
            try {
                IncidentDocument saved = reconciler.reconcile(observation);
                touched.add(saved);
                if (saved.isClosed() && observation.reportsClosed()) {
                    closedInBatch++;
                }
            } catch (InvalidObservationException e) {
                log.debug("Rejected observation from {}: {}", label, e.getMessage());
                rejected++;
            }
        }

        backfillCoordinator.backfillCoordinates(touched);

        log.info("Ingested {} observations from {} ({} rejected, {} closed)",
                touched.size(), label, rejected, closedInBatch);
        return IngestionResult.success(label, touched.size(), rejected, closedInBatch);
    }
}
