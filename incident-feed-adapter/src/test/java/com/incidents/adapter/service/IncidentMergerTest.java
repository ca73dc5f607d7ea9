package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentMerger")
class IncidentMergerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2025-01-01T10:05:00Z");
    private static final Instant T2 = Instant.parse("2025-01-01T10:10:00Z");

    private final IncidentMerger merger = new IncidentMerger(new IncidentProperties());

    @Test
    @DisplayName("Should create a new incident from the first observation")
    void shouldCreateNewIncident() {
        Observation obs = Observation.builder("e1")
                .title("Požár")
                .cityText("Praha")
                .startTimeIso("2025-01-01T09:55:00Z")
                .build()
                .normalized();

        IncidentDocument created = merger.merge(null, obs, T0);

        assertThat(created.getId()).isEqualTo("e1");
        assertThat(created.getTitle()).isEqualTo("Požár");
        assertThat(created.isClosed()).isFalse();
        assertThat(created.getFirstSeenAt()).isEqualTo(T0);
        assertThat(created.getCreatedAt()).isEqualTo(T0);
        assertThat(created.getLastSeenAt()).isEqualTo(T0);
        assertThat(created.getEventTime()).isEqualTo(Instant.parse("2025-01-01T09:55:00Z"));
        assertThat(created.getVersion()).isNull();
    }

    @Test
    @DisplayName("Should keep state except lastSeenAt when the same observation is merged twice")
    void shouldBeIdempotent() {
        Observation obs = Observation.builder("e1").title("A").statusText("ukončená").closed(true)
                .endTimeIso("2025-01-01T09:59:00Z").durationMin(30).build().normalized();

        IncidentDocument once = merger.merge(null, obs, T0);
        IncidentDocument twice = merger.merge(once, obs, T1);

        assertThat(twice)
                .usingRecursiveComparison()
                .ignoringFields("lastSeenAt", "updatedAt")
                .isEqualTo(once);
        assertThat(twice.getLastSeenAt()).isEqualTo(T1);
    }

    @Test
    @DisplayName("Should never reopen a closed incident")
    void shouldKeepClosureSticky() {
        IncidentDocument closed = merger.merge(null,
                Observation.builder("e1").closed(true).build().normalized(), T0);

        IncidentDocument afterOpen = merger.merge(closed,
                Observation.builder("e1").closed(false).statusText("probíhá").build().normalized(), T1);

        assertThat(afterOpen.isClosed()).isTrue();
        assertThat(afterOpen.getClosedDetectedAt()).isEqualTo(T0);
        assertThat(afterOpen.getStatusText()).isEqualTo("probíhá");
    }

    @Test
    @DisplayName("Should stamp closure detection and synthesize end time only on the first closed report")
    void shouldStampClosureOnce() {
        IncidentDocument open = merger.merge(null, Observation.builder("e1").build().normalized(), T0);
        IncidentDocument closed = merger.merge(open, Observation.builder("e1").closed(true).build().normalized(), T1);
        IncidentDocument again = merger.merge(closed, Observation.builder("e1").closed(true).build().normalized(), T2);

        assertThat(closed.getClosedDetectedAt()).isEqualTo(T1);
        assertThat(closed.getEndTimeIso()).isEqualTo(T1.toString());
        assertThat(again.getClosedDetectedAt()).isEqualTo(T1);
        assertThat(again.getEndTimeIso()).isEqualTo(T1.toString());
    }

    @Test
    @DisplayName("Should not overwrite a stored duration with an absent or implausible one")
    void shouldKeepDurationStable() {
        IncidentDocument withDuration = merger.merge(null,
                Observation.builder("e1").closed(true).durationMin(45).build().normalized(), T0);

        IncidentDocument absent = merger.merge(withDuration, Observation.builder("e1").build().normalized(), T1);
        IncidentDocument implausible = merger.merge(absent,
                Observation.builder("e1").durationMin(10_000).build().normalized(), T2);
        IncidentDocument better = merger.merge(implausible,
                Observation.builder("e1").durationMin(50).build().normalized(), T2);

        assertThat(absent.getDurationMin()).isEqualTo(45);
        assertThat(implausible.getDurationMin()).isEqualTo(45);
        assertThat(better.getDurationMin()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should clear a stored duration above the ceiling")
    void shouldClearImplausibleStoredDuration() {
        IncidentDocument stored = merger.merge(null, Observation.builder("e1").build().normalized(), T0);
        stored.setDurationMin(9000);

        IncidentDocument merged = merger.merge(stored, Observation.builder("e1").build().normalized(), T1);

        assertThat(merged.getDurationMin()).isNull();
    }

    @Test
    @DisplayName("Should replace text with present values and keep it for absent ones")
    void shouldPreferPresentText() {
        IncidentDocument stored = merger.merge(null,
                Observation.builder("e1").title("Old").cityText("Brno").eventType("fire").build().normalized(), T0);

        IncidentDocument merged = merger.merge(stored,
                Observation.builder("e1").title("New").cityText("   ").build().normalized(), T1);

        assertThat(merged.getTitle()).isEqualTo("New");
        assertThat(merged.getCityText()).isEqualTo("Brno");
        assertThat(merged.getEventType()).isEqualTo("fire");
    }

    @Test
    @DisplayName("Should fill the start time only while it is empty")
    void shouldFillStartOnce() {
        IncidentDocument stored = merger.merge(null,
                Observation.builder("e1").startTimeIso("2025-01-01T09:00:00Z").build().normalized(), T0);

        IncidentDocument merged = merger.merge(stored,
                Observation.builder("e1").startTimeIso("2025-01-01T09:30:00Z").build().normalized(), T1);

        assertThat(merged.getStartTimeIso()).isEqualTo("2025-01-01T09:00:00Z");
    }

    @Test
    @DisplayName("Should carry coordinates and version over and never modify the stored document")
    void shouldCarryOverCoordinates() {
        IncidentDocument stored = merger.merge(null, Observation.builder("e1").title("A").build().normalized(), T0);
        stored.setLat(50.08);
        stored.setLon(14.42);
        stored.setVersion(3L);

        IncidentDocument merged = merger.merge(stored, Observation.builder("e1").title("B").build().normalized(), T1);

        assertThat(merged.getLat()).isEqualTo(50.08);
        assertThat(merged.getLon()).isEqualTo(14.42);
        assertThat(merged.getVersion()).isEqualTo(3L);
        assertThat(stored.getTitle()).isEqualTo("A");
        assertThat(stored.getLastSeenAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Should derive event time from publication date when the start is missing")
    void shouldResolveEventTimeFromPubDate() {
        IncidentDocument merged = merger.merge(null,
                Observation.builder("e1").pubDate("Wed, 01 Jan 2025 08:00:00 GMT").build().normalized(), T0);

        assertThat(merged.getEventTime()).isEqualTo(Instant.parse("2025-01-01T08:00:00Z"));

        IncidentDocument bare = merger.merge(null, Observation.builder("e2").build().normalized(), T0);
        assertThat(bare.getEventTime()).isEqualTo(T0);
    }
}
