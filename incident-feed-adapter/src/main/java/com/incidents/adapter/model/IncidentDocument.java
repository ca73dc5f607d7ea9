package com.incidents.adapter.model;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One tracked incident, keyed by the feed's stable identifier.
 * Written by the reconciler as a whole document and by the backfill passes field by field.
 */
@Document(collection = "incidents")
public class IncidentDocument extends BaseDocument {

    private String title;
    private String link;
    private String pubDate;

    private String placeText;
    private String cityText;
    private String statusText;

    @Indexed
    private String eventType;

    private String descriptionRaw;

    private String startTimeIso;
    private String endTimeIso;
    private Integer durationMin;

    @Indexed
    private boolean closed;

    @Indexed
    private Instant closedDetectedAt;

    private Double lat;
    private Double lon;

    /**
     * Start time if parseable, else publication time, else creation time
     */
    @Indexed
    private Instant eventTime;

    private Instant firstSeenAt;
    private Instant lastSeenAt;

    @Version
    private Long version;

    public IncidentDocument() {
        super();
    }

    public IncidentDocument(IncidentDocument other) {
        super(other);
        this.title = other.title;
        this.link = other.link;
        this.pubDate = other.pubDate;
        this.placeText = other.placeText;
        this.cityText = other.cityText;
        this.statusText = other.statusText;
        this.eventType = other.eventType;
        this.descriptionRaw = other.descriptionRaw;
        this.startTimeIso = other.startTimeIso;
        this.endTimeIso = other.endTimeIso;
        this.durationMin = other.durationMin;
        this.closed = other.closed;
        this.closedDetectedAt = other.closedDetectedAt;
        this.lat = other.lat;
        this.lon = other.lon;
        this.eventTime = other.eventTime;
        this.firstSeenAt = other.firstSeenAt;
        this.lastSeenAt = other.lastSeenAt;
        this.version = other.version;
    }

    public boolean hasCoordinates() {
        return lat != null && lon != null;
    }

    /**
     * Text used as the geocoding query: city if known, else the raw place
     */
    public String getLocationQuery() {
        if (cityText != null && !cityText.isBlank()) {
            return cityText;
        }
        return placeText;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getLink() {
        return link;
    }

    public void setLink(String link) {
        this.link = link;
    }

    public String getPubDate() {
        return pubDate;
    }

    public void setPubDate(String pubDate) {
        this.pubDate = pubDate;
    }

    public String getPlaceText() {
        return placeText;
    }

    public void setPlaceText(String placeText) {
        this.placeText = placeText;
    }

    public String getCityText() {
        return cityText;
    }

    public void setCityText(String cityText) {
        this.cityText = cityText;
    }

    public String getStatusText() {
        return statusText;
    }

    public void setStatusText(String statusText) {
        this.statusText = statusText;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getDescriptionRaw() {
        return descriptionRaw;
    }

    public void setDescriptionRaw(String descriptionRaw) {
        this.descriptionRaw = descriptionRaw;
    }

    public String getStartTimeIso() {
        return startTimeIso;
    }

    public void setStartTimeIso(String startTimeIso) {
        this.startTimeIso = startTimeIso;
    }

    public String getEndTimeIso() {
        return endTimeIso;
    }

    public void setEndTimeIso(String endTimeIso) {
        this.endTimeIso = endTimeIso;
    }

    public Integer getDurationMin() {
        return durationMin;
    }

    public void setDurationMin(Integer durationMin) {
        this.durationMin = durationMin;
    }

    public boolean isClosed() {
        return closed;
    }

    public void setClosed(boolean closed) {
        this.closed = closed;
    }

    public Instant getClosedDetectedAt() {
        return closedDetectedAt;
    }

    public void setClosedDetectedAt(Instant closedDetectedAt) {
        this.closedDetectedAt = closedDetectedAt;
    }

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLon() {
        return lon;
    }

    public void setLon(Double lon) {
        this.lon = lon;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public void setEventTime(Instant eventTime) {
        this.eventTime = eventTime;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
