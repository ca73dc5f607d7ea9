package com.incidents.adapter.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.Coordinates;
import com.incidents.adapter.model.GeoBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Client for an OpenStreetMap Nominatim search endpoint, scoped to the operating country.
 * <p>
 * Calls are serialized and spaced by the configured minimum interval. A call is never retried here:
 * timeouts, HTTP errors and unreadable bodies surface as {@link GeocoderException}.
 */
@Component
public class NominatimClient {

    private static final Logger log = LoggerFactory.getLogger(NominatimClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String countryCode;
    private final String viewbox;
    private final Duration timeout;
    private final long minIntervalNanos;

    private final Object throttleLock = new Object();
    private long lastCallNanos;
    private boolean called;

    public NominatimClient(WebClient geocoderWebClient, ObjectMapper objectMapper, IncidentProperties properties) {
        this.webClient = geocoderWebClient;
        this.objectMapper = objectMapper;
        GeoBounds bounds = properties.getRegion().toBounds();
        this.countryCode = properties.getRegion().getCountryCode();
        this.viewbox = bounds.toViewbox();
        this.timeout = properties.getGeocoder().getTimeout();
        this.minIntervalNanos = properties.getGeocoder().getMinInterval().toNanos();
    }

    /**
     * Searches for a free-text place and returns the first candidate.
     *
     * @return coordinates of the first candidate, empty when there is none or it has no numeric lat/lon
     * @throws GeocoderException when the lookup itself failed
     */
    public Optional<Coordinates> search(String query) {
        log.debug("Geocoding: q={}", query);

        synchronized (throttleLock) {
            awaitSlot();
            try {
                String response = webClient.get()
                        .uri(builder -> builder.path("/search")
                                .queryParam("format", "json")
                                .queryParam("limit", 3)
                                .queryParam("q", query)
                                .queryParam("countrycodes", countryCode)
                                .queryParam("bounded", 1)
                                .queryParam("viewbox", viewbox)
                                .build())
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(timeout);

                return firstCandidate(response);
            } catch (WebClientResponseException e) {
                log.warn("Geocoder HTTP error: q={}, status={}", query, e.getStatusCode());
                throw new GeocoderException("Geocoder returned " + e.getStatusCode().value(), e);
            } catch (GeocoderException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Error calling geocoder: q={}, error={}", query, e.getMessage());
                throw new GeocoderException("Failed to call geocoder: " + e.getMessage(), e);
            } finally {
                lastCallNanos = System.nanoTime();
                called = true;
            }
        }
    }

    private Optional<Coordinates> firstCandidate(String response) throws IOException {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        JsonNode root = objectMapper.readTree(response);
        if (!root.isArray() || root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = root.get(0);
        Double lat = readNumber(first.get("lat"));
        Double lon = readNumber(first.get("lon"));
        if (lat == null || lon == null) {
            return Optional.empty();
        }
        return Optional.of(new Coordinates(lat, lon));
    }

    private static Double readNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            double value = Double.parseDouble(node.asText().trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void awaitSlot() {
        if (!called) {
            return;
        }
        long waitNanos = minIntervalNanos - (System.nanoTime() - lastCallNanos);
        if (waitNanos <= 0) {
            return;
        }
        try {
            Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocoderException("Interrupted while waiting for the geocoder rate limit", e);
        }
    }

    /**
     * The lookup could not be completed this round.
     */
    public static class GeocoderException extends RuntimeException {
        public GeocoderException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
