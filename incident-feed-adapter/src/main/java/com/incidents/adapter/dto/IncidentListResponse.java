package com.incidents.adapter.dto;

import java.util.List;

/**
 * Listing result together with what the inline repair passes did to it.
 *
 * @param durationsFixed      durations computed and stored while serving this listing
 * @param geocodingCandidates incidents without coordinates offered to the background geocoding pass
 */
public record IncidentListResponse(
        int count,
        int durationsFixed,
        int geocodingCandidates,
        List<IncidentResponse> items
) {
}
