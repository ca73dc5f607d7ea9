package com.incidents.adapter.dto;

/**
 * Counters of one re-geocode sweep over incidents placed outside the region.
 * {@code remaining} counts incidents found but not reached before the time budget ran out
 */
public record RegeocodeResult(
        int processed,
        int cacheDeleted,
        int cleared,
        int regeocoded,
        int failed,
        int remaining
) {
}
