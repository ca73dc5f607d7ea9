package com.incidents.adapter.dto;

import com.incidents.adapter.model.Observation;

import java.util.List;

/**
 * Batch of observations pushed by a feed reader.
 *
 * @param source free-form name of the producing feed, used in logs and the result
 */
public record IngestRequest(
        String source,
        List<Observation> items
) {
}
