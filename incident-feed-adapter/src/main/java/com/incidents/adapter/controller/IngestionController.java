package com.incidents.adapter.controller;

import com.incidents.adapter.dto.IngestRequest;
import com.incidents.adapter.model.IngestionResult;
import com.incidents.adapter.security.SecretGuard;
import com.incidents.adapter.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoint receiving observation batches from feed readers.
 */
@RestController
@RequestMapping("/api/ingest")
@Tag(name = "Ingestion", description = "Push incident observations to be reconciled into MongoDB")
public class IngestionController {

    private final IngestionService ingestionService;
    private final SecretGuard secretGuard;

    public IngestionController(IngestionService ingestionService, SecretGuard secretGuard) {
        this.ingestionService = ingestionService;
        this.secretGuard = secretGuard;
    }

    @PostMapping
    @Operation(summary = "Ingest observations",
               description = "Reconcile a batch of observations. Observations without an id are counted as rejected. " +
                       "Coordinates of the touched incidents are resolved in the background.")
    public ResponseEntity<Map<String, Object>> ingest(
            @Parameter(description = "Shared feed API key")
            @RequestHeader(value = "X-API-Key", required = false) String apiKey,
            @RequestBody IngestRequest request
    ) {
        secretGuard.requireApiKey(apiKey);
        IngestionResult result = ingestionService.ingest(request.source(), request.items());
        return buildResponse(result);
    }

    /**
     * Build a consistent response from an IngestionResult
     */
    private ResponseEntity<Map<String, Object>> buildResponse(IngestionResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isSuccess());
        response.put("source", result.getSource());
        response.put("message", result.getMessage());
        response.put("accepted", result.getAccepted());
        response.put("rejected", result.getRejected());
        response.put("closedInBatch", result.getClosedInBatch());

        if (result.getErrorType() != null) {
            response.put("errorType", result.getErrorType());
        }

        // business-level outcome travels in the success flag
        return ResponseEntity.ok(response);
    }
}
