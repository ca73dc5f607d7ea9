package com.incidents.adapter.model;

import java.time.Instant;

/**
 * Half-open instant range [from, to).
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow intersect(TimeWindow other) {
        Instant start = from.isAfter(other.from) ? from : other.from;
        Instant end = to.isBefore(other.to) ? to : other.to;
        // disjoint windows collapse to an empty range
        return end.isAfter(start) ? new TimeWindow(start, end) : new TimeWindow(start, start);
    }
}
