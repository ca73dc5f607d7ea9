package com.incidents.adapter.controller;

import com.incidents.adapter.repository.IncidentRepository;
import com.incidents.adapter.service.BackfillCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final IncidentRepository incidentRepository;
    private final BackfillCoordinator backfillCoordinator;
    private final Clock clock;

    public HealthController(IncidentRepository incidentRepository, BackfillCoordinator backfillCoordinator, Clock clock) {
        this.incidentRepository = incidentRepository;
        this.backfillCoordinator = backfillCoordinator;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", clock.instant());

        try {
            health.put("incidentCount", incidentRepository.count());
            health.put("dataAccess", "OK");
        } catch (DataAccessException e) {
            health.put("dataAccess", "ERROR: " + e.getMessage());
        }

        health.put("coordinateBackfillRunning", backfillCoordinator.isCoordinateBackfillRunning());
        return health;
    }
}
