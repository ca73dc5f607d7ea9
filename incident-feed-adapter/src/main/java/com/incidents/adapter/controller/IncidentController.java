package com.incidents.adapter.controller;

import com.incidents.adapter.dto.IncidentListResponse;
import com.incidents.adapter.dto.IncidentResponse;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.IncidentFilter;
import com.incidents.adapter.service.BackfillCoordinator;
import com.incidents.adapter.service.IncidentQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints to query reconciled incidents.
 * Listing also repairs what it can: durations inline, coordinates in the background.
 */
@RestController
@RequestMapping("/api/events")
@Tag(name = "Incidents", description = "Query reconciled incidents from MongoDB")
public class IncidentController {

    private final IncidentQueryService queryService;
    private final BackfillCoordinator backfillCoordinator;

    public IncidentController(IncidentQueryService queryService, BackfillCoordinator backfillCoordinator) {
        this.queryService = queryService;
        this.backfillCoordinator = backfillCoordinator;
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "Filtered listing, newest first by event time")
    public ResponseEntity<IncidentListResponse> list(
            @Parameter(description = "today, yesterday or all", example = "today")
            @RequestParam(required = false) String day,
            @Parameter(description = "open, closed or all", example = "open")
            @RequestParam(required = false) String status,
            @Parameter(description = "Case-insensitive substring of city or place")
            @RequestParam(required = false) String city,
            @Parameter(description = "Exact event type tag", example = "fire")
            @RequestParam(required = false) String type,
            @Parameter(description = "Calendar month (YYYY-MM)", example = "2025-01")
            @RequestParam(required = false) String month,
            @Parameter(description = "Maximum rows (1-2000, default 400)")
            @RequestParam(required = false) Integer limit
    ) {
        IncidentFilter filter = IncidentFilter.of(day, status, city, type, month);
        List<IncidentDocument> rows = queryService.list(filter, limit);

        int durationsFixed = backfillCoordinator.backfillDurations(rows);
        int geocodingCandidates = (int) Math.min(backfillCoordinator.getCoordinateBatch(),
                rows.stream().filter(BackfillCoordinator::needsCoordinates).count());
        backfillCoordinator.backfillCoordinates(rows);

        List<IncidentResponse> items = rows.stream().map(IncidentResponse::from).toList();
        return ResponseEntity.ok(new IncidentListResponse(items.size(), durationsFixed, geocodingCandidates, items));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident by id")
    public ResponseEntity<IncidentResponse> get(
            @Parameter(description = "Feed identifier of the incident")
            @PathVariable String id
    ) {
        return ResponseEntity.ok(IncidentResponse.from(queryService.get(id)));
    }
}
