package com.incidents.stats.controller;

import com.incidents.stats.dto.StatsResponse;
import com.incidents.stats.model.StatsFilter;
import com.incidents.stats.service.StatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/stats")
@Tag(name = "Stats", description = "Aggregates over reconciled incidents")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping
    @Operation(summary = "Incident statistics",
               description = "Open vs closed, per day and per type counts follow the filter. " +
                       "Top locations always cover all incidents; the longest list follows city, type and month only. " +
                       "Cached for 1 minute.")
    public ResponseEntity<StatsResponse> getStats(
            @Parameter(description = "today, yesterday or all", example = "all")
            @RequestParam(required = false) String day,
            @Parameter(description = "open, closed or all", example = "all")
            @RequestParam(required = false) String status,
            @Parameter(description = "Case-insensitive substring of city or place")
            @RequestParam(required = false) String city,
            @Parameter(description = "Exact event type tag", example = "fire")
            @RequestParam(required = false) String type,
            @Parameter(description = "Calendar month (YYYY-MM)", example = "2025-01")
            @RequestParam(required = false) String month
    ) {
        StatsFilter filter = StatsFilter.of(day, status, city, type, month);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.MINUTES))
                .body(statsService.getStats(filter));
    }
}
