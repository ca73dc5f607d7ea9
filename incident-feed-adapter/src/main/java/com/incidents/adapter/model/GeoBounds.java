package com.incidents.adapter.model;

/**
 * Latitude/longitude rectangle of the operating region.
 */
public record GeoBounds(double minLat, double maxLat, double minLon, double maxLon) {

    public boolean contains(Double lat, Double lon) {
        return lat != null && lon != null
                && Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= minLat && lat <= maxLat
                && lon >= minLon && lon <= maxLon;
    }

    public boolean contains(Coordinates coordinates) {
        return coordinates != null && contains(coordinates.lat(), coordinates.lon());
    }

    /**
     * Nominatim viewbox parameter: left,top,right,bottom
     */
    public String toViewbox() {
        return minLon + "," + maxLat + "," + maxLon + "," + minLat;
    }
}
