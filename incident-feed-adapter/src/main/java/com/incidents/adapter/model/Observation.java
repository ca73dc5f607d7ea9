package com.incidents.adapter.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One inbound report about an incident, as produced by the feed reader.
 * Everything except the id may be missing.
 */
public record Observation(
        String id,
        String title,
        String link,
        String pubDate,
        String placeText,
        String cityText,
        String statusText,
        String eventType,
        @JsonAlias({"descRaw", "description"})
        String descriptionRaw,
        String startTimeIso,
        String endTimeIso,
        Integer durationMin,
        @JsonProperty("isClosed")
        Boolean isClosed
) {

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean reportsClosed() {
        return Boolean.TRUE.equals(isClosed);
    }

    /**
     * Copy with every text field trimmed and blank text turned into null.
     */
    public Observation normalized() {
        return new Observation(
                clean(id), clean(title), clean(link), clean(pubDate),
                clean(placeText), clean(cityText), clean(statusText), clean(eventType),
                clean(descriptionRaw), clean(startTimeIso), clean(endTimeIso),
                durationMin, isClosed
        );
    }

    public Observation withDurationMin(Integer minutes) {
        return new Observation(id, title, link, pubDate, placeText, cityText, statusText, eventType,
                descriptionRaw, startTimeIso, endTimeIso, minutes, isClosed);
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {

        private final String id;
        private String title;
        private String link;
        private String pubDate;
        private String placeText;
        private String cityText;
        private String statusText;
        private String eventType;
        private String descriptionRaw;
        private String startTimeIso;
        private String endTimeIso;
        private Integer durationMin;
        private Boolean isClosed;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder link(String link) { this.link = link; return this; }
        public Builder pubDate(String pubDate) { this.pubDate = pubDate; return this; }
        public Builder placeText(String placeText) { this.placeText = placeText; return this; }
        public Builder cityText(String cityText) { this.cityText = cityText; return this; }
        public Builder statusText(String statusText) { this.statusText = statusText; return this; }
        public Builder eventType(String eventType) { this.eventType = eventType; return this; }
        public Builder descriptionRaw(String descriptionRaw) { this.descriptionRaw = descriptionRaw; return this; }
        public Builder startTimeIso(String startTimeIso) { this.startTimeIso = startTimeIso; return this; }
        public Builder endTimeIso(String endTimeIso) { this.endTimeIso = endTimeIso; return this; }
        public Builder durationMin(Integer durationMin) { this.durationMin = durationMin; return this; }
        public Builder closed(Boolean closed) { this.isClosed = closed; return this; }

        public Observation build() {
            return new Observation(id, title, link, pubDate, placeText, cityText, statusText, eventType,
                    descriptionRaw, startTimeIso, endTimeIso, durationMin, isClosed);
        }
    }
}
