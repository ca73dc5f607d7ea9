package com.incidents.stats.controller;

import com.incidents.stats.repository.readonly.IncidentReadRepository;
import com.incidents.stats.service.StatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final IncidentReadRepository incidentRepository;
    private final StatsService statsService;
    private final Clock clock;

    public HealthController(IncidentReadRepository incidentRepository, StatsService statsService, Clock clock) {
        this.incidentRepository = incidentRepository;
        this.statsService = statsService;
        this.clock = clock;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check API and database connectivity")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", clock.instant());

        // Test read access to adapter data
        try {
            health.put("incidentCount", incidentRepository.count());
            health.put("trackingStartedAt", statsService.getTrackingStartedAt());
            health.put("adapterDataAccess", "OK");
        } catch (DataAccessException e) {
            health.put("adapterDataAccess", "ERROR: " + e.getMessage());
        }

        return health;
    }
}
