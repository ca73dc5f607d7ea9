package com.incidents.stats.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Must agree with the adapter's region and duration settings.
 */
@ConfigurationProperties(prefix = "stats")
public class StatsProperties {

    private static final int MAX_MINUTES_FLOOR = 60;

    private ZoneId zone = ZoneId.of("Europe/Prague");

    private double minLat = 48.55;
    private double maxLat = 51.06;
    private double minLon = 12.09;
    private double maxLon = 18.87;

    /**
     * Durations above this many minutes are not listed among the longest incidents
     */
    private int maxDurationMinutes = 4320;

    private int topLocationsLimit = 20;
    private int longestLimit = 20;
    private int byDayLimit = 31;

    public boolean inRegion(Double lat, Double lon) {
        return lat != null && lon != null
                && lat >= minLat && lat <= maxLat
                && lon >= minLon && lon <= maxLon;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }

    public double getMinLat() {
        return minLat;
    }

    public void setMinLat(double minLat) {
        this.minLat = minLat;
    }

    public double getMaxLat() {
        return maxLat;
    }

    public void setMaxLat(double maxLat) {
        this.maxLat = maxLat;
    }

    public double getMinLon() {
        return minLon;
    }

    public void setMinLon(double minLon) {
        this.minLon = minLon;
    }

    public double getMaxLon() {
        return maxLon;
    }

    public void setMaxLon(double maxLon) {
        this.maxLon = maxLon;
    }

    public int getMaxDurationMinutes() {
        return maxDurationMinutes;
    }

    public void setMaxDurationMinutes(int maxDurationMinutes) {
        this.maxDurationMinutes = Math.max(MAX_MINUTES_FLOOR, maxDurationMinutes);
    }

    public int getTopLocationsLimit() {
        return topLocationsLimit;
    }

    public void setTopLocationsLimit(int topLocationsLimit) {
        this.topLocationsLimit = topLocationsLimit;
    }

    public int getLongestLimit() {
        return longestLimit;
    }

    public void setLongestLimit(int longestLimit) {
        this.longestLimit = longestLimit;
    }

    public int getByDayLimit() {
        return byDayLimit;
    }

    public void setByDayLimit(int byDayLimit) {
        this.byDayLimit = byDayLimit;
    }
}
