package com.incidents.stats.model;

import java.time.Instant;

/**
 * Half-open event-time range [from, to); empty when from equals to.
 */
public record EventWindow(Instant from, Instant to) {
}
