package com.incidents.stats.dto;

import com.incidents.stats.model.StatsFilter;

import java.time.Instant;
import java.util.List;

/**
 * Aggregates over reconciled incidents.
 * <ul>
 *   <li>openVsClosed, byDay and byType follow every filter</li>
 *   <li>topLocations ignores the filter and skips incidents placed outside the region</li>
 *   <li>longest covers incidents closed after trackingStartedAt and follows city, type and month only</li>
 * </ul>
 */
public record StatsResponse(
        StatsFilter filter,
        OpenClosed openVsClosed,
        List<DayCount> byDay,
        List<TypeCount> byType,
        List<LocationCount> topLocations,
        List<LongestIncident> longest,
        Instant trackingStartedAt
) {
}
