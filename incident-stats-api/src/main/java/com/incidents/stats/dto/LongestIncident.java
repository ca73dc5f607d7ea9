package com.incidents.stats.dto;

import com.incidents.stats.model.readonly.IncidentDocument;

import java.time.Instant;

public record LongestIncident(
        String id,
        String title,
        String link,
        String cityText,
        String placeText,
        String eventType,
        int durationMin,
        Instant closedDetectedAt
) {

    public static LongestIncident from(IncidentDocument doc) {
        return new LongestIncident(doc.getId(), doc.getTitle(), doc.getLink(), doc.getCityText(), doc.getPlaceText(),
                doc.getEventType(), doc.getDurationMin(), doc.getClosedDetectedAt());
    }
}
