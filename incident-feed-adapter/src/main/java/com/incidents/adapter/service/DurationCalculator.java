package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Elapsed-minutes computation with a plausibility window.
 * Anything that cannot be trusted comes back empty ("unknown"), never as an error.
 */
@Component
public class DurationCalculator {

    private static final Logger log = LoggerFactory.getLogger(DurationCalculator.class);

    private final Clock clock;
    private final ZoneId zone;
    private final int maxPlausibleMinutes;
    private final Duration futureEndTolerance;

    public DurationCalculator(IncidentProperties properties, Clock clock) {
        this.clock = clock;
        this.zone = properties.getRegion().getZone();
        this.maxPlausibleMinutes = properties.getDuration().getMaxMinutes();
        this.futureEndTolerance = properties.getDuration().getFutureEndTolerance();
    }

    public int getMaxPlausibleMinutes() {
        return maxPlausibleMinutes;
    }

    /**
     * Minutes between start and end, rounded.
     *
     * @param startText     start timestamp text, may be null or unparsable
     * @param endText       end timestamp text
     * @param fallbackStart used when the start text is missing or unparsable (usually first-seen time)
     */
    public Optional<Integer> computeMinutes(String startText, String endText, Instant fallbackStart) {
        Optional<Instant> end = TimestampParser.parse(endText, zone);
        if (end.isEmpty()) {
            return Optional.empty();
        }
        Instant start = TimestampParser.parse(startText, zone).orElse(fallbackStart);
        return computeMinutes(start, end.get());
    }

    /**
     * Parses a feed timestamp in the region zone.
     */
    public Optional<Instant> parse(String text) {
        return TimestampParser.parse(text, zone);
    }

    public Optional<Integer> computeMinutes(Instant start, Instant end) {
        if (start == null || end == null) {
            return Optional.empty();
        }
        if (end.isAfter(clock.instant().plus(futureEndTolerance))) {
            log.debug("End {} lies in the future, duration unknown", end);
            return Optional.empty();
        }
        long minutes = Math.round(Duration.between(start, end).toMillis() / 60_000.0);
        return clamp(minutes);
    }

    /**
     * Applies the plausibility window to an already known value.
     */
    public Optional<Integer> clamp(Integer minutes) {
        return minutes == null ? Optional.empty() : clamp(minutes.longValue());
    }

    public boolean isPlausible(Integer minutes) {
        return minutes != null && minutes > 0 && minutes <= maxPlausibleMinutes;
    }

    private Optional<Integer> clamp(long minutes) {
        if (minutes <= 0) {
            return Optional.empty();
        }
        if (minutes > maxPlausibleMinutes) {
            log.debug("Duration of {} min exceeds {} min, treated as unknown", minutes, maxPlausibleMinutes);
            return Optional.empty();
        }
        return Optional.of((int) minutes);
    }
}
