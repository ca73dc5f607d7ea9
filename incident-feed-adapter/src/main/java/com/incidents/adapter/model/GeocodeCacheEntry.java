package com.incidents.adapter.model;

import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Resolved coordinates for a normalized place-name query (the document id).
 */
@Document(collection = "geocode_cache")
public class GeocodeCacheEntry extends BaseDocument {

    private Double lat;
    private Double lon;

    public GeocodeCacheEntry() {
        super();
    }

    public GeocodeCacheEntry(String query, Double lat, Double lon) {
        super();
        setId(query);
        this.lat = lat;
        this.lon = lon;
    }

    public String getQuery() {
        return getId();
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
}
