package com.incidents.adapter.service;

import com.incidents.adapter.client.NominatimClient;
import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.Coordinates;
import com.incidents.adapter.model.GeoBounds;
import com.incidents.adapter.model.GeocodeCacheEntry;
import com.incidents.adapter.repository.GeocodeCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Place-name to coordinates resolution backed by a persistent cache.
 * Nothing outside the region rectangle is ever returned or cached; stale out-of-region
 * entries are evicted when met.
 */
@Service
public class GeocodeCache {

    private static final Logger log = LoggerFactory.getLogger(GeocodeCache.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISTRICT_PREFIX = Pattern.compile("^(?i)(okres\\s+|ok\\.\\s*)");

    private final GeocodeCacheRepository cacheRepository;
    private final NominatimClient nominatimClient;
    private final GeoBounds bounds;
    private final Clock clock;

    public GeocodeCache(GeocodeCacheRepository cacheRepository, NominatimClient nominatimClient,
                        IncidentProperties properties, Clock clock) {
        this.cacheRepository = cacheRepository;
        this.nominatimClient = nominatimClient;
        this.bounds = properties.getRegion().toBounds();
        this.clock = clock;
    }

    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    public Optional<Coordinates> resolve(String query) {
        String key = normalize(query);
        if (key.length() < 2) {
            return Optional.empty();
        }

        Optional<GeocodeCacheEntry> cached = cacheRepository.findById(key);
        if (cached.isPresent()) {
            GeocodeCacheEntry entry = cached.get();
            if (bounds.contains(entry.getLat(), entry.getLon())) {
                return Optional.of(new Coordinates(entry.getLat(), entry.getLon()));
            }
            log.info("Evicting out-of-region cache entry for '{}' ({}, {})", key, entry.getLat(), entry.getLon());
            cacheRepository.deleteById(key);
        }

        for (String candidate : queryVariants(key)) {
            Optional<Coordinates> found;
            try {
                found = nominatimClient.search(candidate);
            } catch (NominatimClient.GeocoderException e) {
                log.warn("Geocoding '{}' unresolved this round: {}", candidate, e.getMessage());
                return Optional.empty();
            }
            if (found.isEmpty()) {
                continue;
            }
            Coordinates coordinates = found.get();
            if (!bounds.contains(coordinates)) {
                log.info("Geocoder placed '{}' outside the region at ({}, {}), ignoring",
                        candidate, coordinates.lat(), coordinates.lon());
                return Optional.empty();
            }
            Instant now = clock.instant();
            GeocodeCacheEntry entry = new GeocodeCacheEntry(key, coordinates.lat(), coordinates.lon());
            entry.setCreatedAt(cached.map(GeocodeCacheEntry::getCreatedAt).orElse(now));
            entry.setUpdatedAt(now);
            cacheRepository.save(entry);
            return Optional.of(coordinates);
        }
        return Optional.empty();
    }

    public void invalidate(String query) {
        String key = normalize(query);
        if (!key.isEmpty()) {
            cacheRepository.deleteById(key);
        }
    }

    private static List<String> queryVariants(String key) {
        List<String> variants = new ArrayList<>();
        variants.add(key);
        String stripped = DISTRICT_PREFIX.matcher(key).replaceFirst("").trim();
        if (stripped.length() >= 2 && !stripped.equals(key)) {
            variants.add(stripped);
        }
        return variants;
    }
}
