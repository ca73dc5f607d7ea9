package com.incidents.adapter.service;

import com.incidents.adapter.client.NominatimClient;
import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.Coordinates;
import com.incidents.adapter.model.GeocodeCacheEntry;
import com.incidents.adapter.repository.GeocodeCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GeocodeCache")
class GeocodeCacheTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    @Mock
    private GeocodeCacheRepository cacheRepository;

    @Mock
    private NominatimClient nominatimClient;

    private GeocodeCache geocodeCache;

    @BeforeEach
    void setUp() {
        geocodeCache = new GeocodeCache(cacheRepository, nominatimClient, new IncidentProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should return a cached in-region entry without calling the geocoder")
    void shouldServeFromCache() {
        when(cacheRepository.findById("Kolín")).thenReturn(Optional.of(new GeocodeCacheEntry("Kolín", 50.03, 15.20)));

        Optional<Coordinates> result = geocodeCache.resolve("  Kolín ");

        assertThat(result).contains(new Coordinates(50.03, 15.20));
        verifyNoInteractions(nominatimClient);
    }

    @Test
    @DisplayName("Should return none and cache nothing when the geocoder places Kladno outside the region")
    void shouldRejectOutOfRegionResult() {
        when(cacheRepository.findById("Kladno")).thenReturn(Optional.empty());
        when(nominatimClient.search("Kladno")).thenReturn(Optional.of(new Coordinates(40.0, -3.0)));

        Optional<Coordinates> result = geocodeCache.resolve("Kladno");

        assertThat(result).isEmpty();
        verify(cacheRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should evict an out-of-region cache entry and resolve again")
    void shouldEvictStaleEntry() {
        when(cacheRepository.findById("Beroun")).thenReturn(Optional.of(new GeocodeCacheEntry("Beroun", 40.0, -3.0)));
        when(nominatimClient.search("Beroun")).thenReturn(Optional.of(new Coordinates(49.96, 14.07)));

        Optional<Coordinates> result = geocodeCache.resolve("Beroun");

        assertThat(result).contains(new Coordinates(49.96, 14.07));
        verify(cacheRepository).deleteById("Beroun");
        ArgumentCaptor<GeocodeCacheEntry> saved = ArgumentCaptor.forClass(GeocodeCacheEntry.class);
        verify(cacheRepository).save(saved.capture());
        assertThat(saved.getValue().getQuery()).isEqualTo("Beroun");
        assertThat(saved.getValue().getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should keep the original creation time when an entry is resolved again")
    void shouldKeepCreatedAtOnRefresh() {
        Instant firstCached = Instant.parse("2024-06-01T08:00:00Z");
        GeocodeCacheEntry stale = new GeocodeCacheEntry("Beroun", 40.0, -3.0);
        stale.setCreatedAt(firstCached);
        stale.setUpdatedAt(firstCached);
        when(cacheRepository.findById("Beroun")).thenReturn(Optional.of(stale));
        when(nominatimClient.search("Beroun")).thenReturn(Optional.of(new Coordinates(49.96, 14.07)));

        geocodeCache.resolve("Beroun");

        ArgumentCaptor<GeocodeCacheEntry> saved = ArgumentCaptor.forClass(GeocodeCacheEntry.class);
        verify(cacheRepository).save(saved.capture());
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(firstCached);
        assertThat(saved.getValue().getUpdatedAt()).isEqualTo(NOW);
        assertThat(saved.getValue().getLat()).isEqualTo(49.96);
    }

    @Test
    @DisplayName("Should try the query without the district prefix when the full one finds nothing")
    void shouldTryStrippedDistrictVariant() {
        when(cacheRepository.findById("okres Mělník")).thenReturn(Optional.empty());
        when(nominatimClient.search("okres Mělník")).thenReturn(Optional.empty());
        when(nominatimClient.search("Mělník")).thenReturn(Optional.of(new Coordinates(50.35, 14.47)));

        Optional<Coordinates> result = geocodeCache.resolve("okres   Mělník");

        assertThat(result).contains(new Coordinates(50.35, 14.47));
        ArgumentCaptor<GeocodeCacheEntry> saved = ArgumentCaptor.forClass(GeocodeCacheEntry.class);
        verify(cacheRepository).save(saved.capture());
        assertThat(saved.getValue().getQuery()).isEqualTo("okres Mělník");
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should treat a failed lookup as unresolved")
    void shouldSwallowLookupFailure() {
        when(cacheRepository.findById("Most")).thenReturn(Optional.empty());
        when(nominatimClient.search(anyString()))
                .thenThrow(new NominatimClient.GeocoderException("timeout", new RuntimeException()));

        assertThat(geocodeCache.resolve("Most")).isEmpty();
        verify(cacheRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should ignore queries shorter than two characters")
    void shouldIgnoreTooShortQueries() {
        assertThat(geocodeCache.resolve(" x ")).isEmpty();
        assertThat(geocodeCache.resolve(null)).isEmpty();
        verifyNoInteractions(cacheRepository, nominatimClient);
    }

    @Test
    void shouldInvalidateUnconditionally() {
        geocodeCache.invalidate(" Praha  4 ");
        verify(cacheRepository).deleteById("Praha 4");
    }
}
