package com.incidents.adapter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incidents.adapter.model.IncidentDocument;

import java.time.Instant;

/**
 * Public shape of a stored incident
 */
public record IncidentResponse(
        String id,
        String title,
        String link,
        @JsonProperty("pub_date") String pubDate,
        @JsonProperty("place_text") String placeText,
        @JsonProperty("city_text") String cityText,
        @JsonProperty("status_text") String statusText,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("description_raw") String descriptionRaw,
        @JsonProperty("start_time_iso") String startTimeIso,
        @JsonProperty("end_time_iso") String endTimeIso,
        @JsonProperty("duration_min") Integer durationMin,
        @JsonProperty("is_closed") boolean closed,
        @JsonProperty("closed_detected_at") Instant closedDetectedAt,
        Double lat,
        Double lon,
        @JsonProperty("first_seen_at") Instant firstSeenAt,
        @JsonProperty("last_seen_at") Instant lastSeenAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public static IncidentResponse from(IncidentDocument doc) {
        return new IncidentResponse(
                doc.getId(),
                doc.getTitle(),
                doc.getLink(),
                doc.getPubDate(),
                doc.getPlaceText(),
                doc.getCityText(),
                doc.getStatusText(),
                doc.getEventType(),
                doc.getDescriptionRaw(),
                doc.getStartTimeIso(),
                doc.getEndTimeIso(),
                doc.getDurationMin(),
                doc.isClosed(),
                doc.getClosedDetectedAt(),
                doc.getLat(),
                doc.getLon(),
                doc.getFirstSeenAt(),
                doc.getLastSeenAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
