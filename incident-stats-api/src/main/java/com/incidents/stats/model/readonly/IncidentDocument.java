package com.incidents.stats.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Read-only model for incidents reconciled by the feed adapter.
 * This service never writes to this collection.
 */
@Document(collection = "incidents")
public class IncidentDocument {

    @Id
    private String id;

    private String title;
    private String link;
    private String placeText;
    private String cityText;
    private String statusText;
    private String eventType;

    private String startTimeIso;
    private String endTimeIso;
    private Integer durationMin;

    private boolean closed;
    private Instant closedDetectedAt;

    private Double lat;
    private Double lon;

    private Instant eventTime;
    private Instant firstSeenAt;
    private Instant lastSeenAt;
    private Instant createdAt;
    private Instant updatedAt;

    // Getters only (read-only)
    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getLink() { return link; }
    public String getPlaceText() { return placeText; }
    public String getCityText() { return cityText; }
    public String getStatusText() { return statusText; }
    public String getEventType() { return eventType; }
    public String getStartTimeIso() { return startTimeIso; }
    public String getEndTimeIso() { return endTimeIso; }
    public Integer getDurationMin() { return durationMin; }
    public boolean isClosed() { return closed; }
    public Instant getClosedDetectedAt() { return closedDetectedAt; }
    public Double getLat() { return lat; }
    public Double getLon() { return lon; }
    public Instant getEventTime() { return eventTime; }
    public Instant getFirstSeenAt() { return firstSeenAt; }
    public Instant getLastSeenAt() { return lastSeenAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Event time as stored by the adapter, creation time for records written before it existed
     */
    public Instant resolveEventTime() {
        return eventTime != null ? eventTime : createdAt;
    }

    public boolean hasCoordinates() {
        return lat != null && lon != null;
    }

    /**
     * Label used for location rankings: city, else place, else "(unknown)"
     */
    public String locationLabel() {
        if (cityText != null && !cityText.isBlank()) {
            return cityText.trim();
        }
        if (placeText != null && !placeText.isBlank()) {
            return placeText.trim();
        }
        return "(unknown)";
    }
}
