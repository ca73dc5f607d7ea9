package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.Observation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Merges one observation into the stored state of an incident.
 * <p>
 * Pure function of (stored state, observation, now): no I/O, the input document is never modified.
 * Policy:
 * <ul>
 *   <li>descriptive text (title, link, pubDate, place, city, status, type, description):
 *       a present incoming value replaces the stored one, an absent one keeps it</li>
 *   <li>start time: filled only while empty</li>
 *   <li>end time: an explicit incoming value wins; otherwise "now" on the first closed report</li>
 *   <li>closed: sticky; closedDetectedAt stamped once on the open-to-closed transition</li>
 *   <li>duration: a plausible incoming value wins; otherwise an implausible stored value is cleared</li>
 *   <li>firstSeenAt/createdAt fixed at creation; lastSeenAt/updatedAt always advance</li>
 * </ul>
 * Coordinates and version are carried over untouched.
 */
@Component
public class IncidentMerger {

    private final ZoneId zone;
    private final int maxPlausibleMinutes;

    public IncidentMerger(IncidentProperties properties) {
        this.zone = properties.getRegion().getZone();
        this.maxPlausibleMinutes = properties.getDuration().getMaxMinutes();
    }

    /**
     * @param stored      current state, or null when the incident has never been seen
     * @param observation normalized observation (see {@link Observation#normalized()})
     * @param now         the instant this merge happens at
     * @return the new state to persist
     */
    public IncidentDocument merge(IncidentDocument stored, Observation observation, Instant now) {
        IncidentDocument merged;
        if (stored == null) {
            merged = new IncidentDocument();
            merged.setId(observation.id());
            merged.setCreatedAt(now);
            merged.setFirstSeenAt(now);
        } else {
            merged = new IncidentDocument(stored);
        }

        merged.setTitle(prefer(observation.title(), merged.getTitle()));
        merged.setLink(prefer(observation.link(), merged.getLink()));
        merged.setPubDate(prefer(observation.pubDate(), merged.getPubDate()));
        merged.setPlaceText(prefer(observation.placeText(), merged.getPlaceText()));
        merged.setCityText(prefer(observation.cityText(), merged.getCityText()));
        merged.setStatusText(prefer(observation.statusText(), merged.getStatusText()));
        merged.setEventType(prefer(observation.eventType(), merged.getEventType()));
        merged.setDescriptionRaw(prefer(observation.descriptionRaw(), merged.getDescriptionRaw()));

        if (merged.getStartTimeIso() == null) {
            merged.setStartTimeIso(observation.startTimeIso());
        }

        boolean wasClosed = stored != null && stored.isClosed();
        boolean closesNow = !wasClosed && observation.reportsClosed();

        if (observation.endTimeIso() != null) {
            merged.setEndTimeIso(observation.endTimeIso());
        } else if (closesNow) {
            merged.setEndTimeIso(now.toString());
        }

        merged.setClosed(wasClosed || observation.reportsClosed());
        if (closesNow) {
            merged.setClosedDetectedAt(now);
        }

        merged.setDurationMin(mergeDuration(merged.getDurationMin(), observation.durationMin()));

        merged.setEventTime(resolveEventTime(merged));
        merged.setLastSeenAt(now);
        merged.setUpdatedAt(now);
        return merged;
    }

    /**
     * Start time if it parses, else publication time, else creation time.
     */
    public Instant resolveEventTime(IncidentDocument incident) {
        Optional<Instant> start = TimestampParser.looksLikeIsoDate(incident.getStartTimeIso())
                ? TimestampParser.parse(incident.getStartTimeIso(), zone)
                : Optional.empty();
        return start
                .or(() -> TimestampParser.parse(incident.getPubDate(), zone))
                .orElse(incident.getCreatedAt());
    }

    private Integer mergeDuration(Integer stored, Integer incoming) {
        if (isPlausible(incoming)) {
            return incoming;
        }
        if (stored != null && stored > maxPlausibleMinutes) {
            return null;
        }
        return stored;
    }

    private boolean isPlausible(Integer minutes) {
        return minutes != null && minutes > 0 && minutes <= maxPlausibleMinutes;
    }

    private static String prefer(String incoming, String stored) {
        return incoming != null ? incoming : stored;
    }
}
