package com.incidents.adapter.controller;

import com.incidents.adapter.dto.RegeocodeResult;
import com.incidents.adapter.security.SecretGuard;
import com.incidents.adapter.service.MaintenanceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Operator endpoints for store-wide repair passes.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Store-wide duration and coordinate repair")
public class AdminController {

    private final MaintenanceService maintenanceService;
    private final SecretGuard secretGuard;

    public AdminController(MaintenanceService maintenanceService, SecretGuard secretGuard) {
        this.maintenanceService = maintenanceService;
        this.secretGuard = secretGuard;
    }

    @PostMapping("/recalc")
    @Operation(summary = "Recalculate durations",
               description = "Compute missing durations of closed incidents across the whole store")
    public ResponseEntity<Map<String, Object>> recalculate(
            @Parameter(description = "Admin password")
            @RequestHeader(value = "X-Admin-Password", required = false) String password,
            @Parameter(description = "Maximum incidents examined (1-10000)")
            @RequestParam(defaultValue = "2000") int limit
    ) {
        secretGuard.requireAdminPassword(password);
        int fixed = maintenanceService.recalculateDurations(limit);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("fixed", fixed);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/regeocode")
    @Operation(summary = "Re-geocode incidents outside the region",
               description = "Drop cached lookups and coordinates of incidents placed outside the region and geocode them again. " +
                       "Geocoder calls are rate limited; one sweep stops at its time budget and reports the incidents left for the next one.")
    public CompletableFuture<ResponseEntity<RegeocodeResult>> regeocode(
            @Parameter(description = "Shared API key")
            @RequestHeader(value = "X-API-Key", required = false) String apiKey,
            @Parameter(description = "Maximum incidents processed (1-2000)")
            @RequestParam(defaultValue = "200") int limit
    ) {
        secretGuard.requireApiKey(apiKey);
        return maintenanceService.regeocodeOutsideRegion(limit).thenApply(ResponseEntity::ok);
    }
}
