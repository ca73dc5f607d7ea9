package com.incidents.adapter.config;

import com.incidents.adapter.model.GeoBounds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "incidents")
public class IncidentProperties {

    /**
     * Shared secret expected in the X-API-Key header of ingest and re-geocode calls
     */
    private String apiKey;

    /**
     * Expected in the X-Admin-Password header of the recalculation endpoint
     */
    private String adminPassword;

    private final DurationSettings duration = new DurationSettings();
    private final Region region = new Region();
    private final Geocoder geocoder = new Geocoder();
    private final Backfill backfill = new Backfill();
    private final Maintenance maintenance = new Maintenance();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getAdminPassword() {
        return adminPassword;
    }

    public void setAdminPassword(String adminPassword) {
        this.adminPassword = adminPassword;
    }

    public DurationSettings getDuration() {
        return duration;
    }

    public Region getRegion() {
        return region;
    }

    public Geocoder getGeocoder() {
        return geocoder;
    }

    public Backfill getBackfill() {
        return backfill;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public static class DurationSettings {

        /**
         * Lowest accepted value for the plausibility ceiling, in minutes
         */
        public static final int MAX_MINUTES_FLOOR = 60;

        /**
         * Durations above this many minutes are treated as unknown (default 3 days)
         */
        private int maxMinutes = 4320;

        /**
         * End timestamps further than this in the future are rejected
         */
        private Duration futureEndTolerance = Duration.ofMinutes(5);

        public int getMaxMinutes() {
            return maxMinutes;
        }

        public void setMaxMinutes(int maxMinutes) {
            this.maxMinutes = Math.max(MAX_MINUTES_FLOOR, maxMinutes);
        }

        public Duration getFutureEndTolerance() {
            return futureEndTolerance;
        }

        public void setFutureEndTolerance(Duration futureEndTolerance) {
            this.futureEndTolerance = futureEndTolerance;
        }
    }

    /**
     * Operating region: the local calendar zone and the rectangle every stored coordinate must fall in.
     */
    public static class Region {

        private ZoneId zone = ZoneId.of("Europe/Prague");
        private String countryCode = "cz";
        private double minLat = 48.55;
        private double maxLat = 51.06;
        private double minLon = 12.09;
        private double maxLon = 18.87;

        public GeoBounds toBounds() {
            return new GeoBounds(minLat, maxLat, minLon, maxLon);
        }

        public ZoneId getZone() {
            return zone;
        }

        public void setZone(ZoneId zone) {
            this.zone = zone;
        }

        public String getCountryCode() {
            return countryCode;
        }

        public void setCountryCode(String countryCode) {
            this.countryCode = countryCode;
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
    }

    public static class Geocoder {

        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String userAgent = "incident-tracker/1.0 (contact: missing)";
        private String acceptLanguage = "cs,en;q=0.8";

        /**
         * Minimum spacing between two upstream calls (Nominatim allows one request per second)
         */
        private Duration minInterval = Duration.ofMillis(1100);

        private Duration timeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public String getAcceptLanguage() {
            return acceptLanguage;
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
        }

        public Duration getMinInterval() {
            return minInterval;
        }

        public void setMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Backfill {

        private int durationBatch = 80;
        private int coordinateBatch = 8;
        private Duration coordinateTimeBudget = Duration.ofSeconds(20);

        public int getDurationBatch() {
            return durationBatch;
        }

        public void setDurationBatch(int durationBatch) {
            this.durationBatch = durationBatch;
        }

        public int getCoordinateBatch() {
            return coordinateBatch;
        }

        public void setCoordinateBatch(int coordinateBatch) {
            this.coordinateBatch = coordinateBatch;
        }

        public Duration getCoordinateTimeBudget() {
            return coordinateTimeBudget;
        }

        public void setCoordinateTimeBudget(Duration coordinateTimeBudget) {
            this.coordinateTimeBudget = coordinateTimeBudget;
        }
    }

    public static class Maintenance {

        private int recalcBatch = 400;

        /**
         * Delay between two scheduled duration recalculations (read by the scheduler placeholder)
         */
        private Duration interval = Duration.ofMinutes(5);

        private Duration initialDelay = Duration.ofMinutes(1);

        /**
         * Wall-clock budget of one administrative re-geocode sweep
         */
        private Duration regeocodeTimeBudget = Duration.ofSeconds(25);

        public int getRecalcBatch() {
            return recalcBatch;
        }

        public void setRecalcBatch(int recalcBatch) {
            this.recalcBatch = recalcBatch;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getRegeocodeTimeBudget() {
            return regeocodeTimeBudget;
        }

        public void setRegeocodeTimeBudget(Duration regeocodeTimeBudget) {
            this.regeocodeTimeBudget = regeocodeTimeBudget;
        }
    }
}
