package com.incidents.adapter.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentFilter")
class IncidentFilterTest {

    private static final ZoneId PRAGUE = ZoneId.of("Europe/Prague");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 15);

    @Test
    @DisplayName("Should fall back to 'all' for unrecognized values")
    void shouldDefaultUnknownValues() {
        IncidentFilter filter = IncidentFilter.of("tomorrow", "maybe", "  ", "", "2025-13");

        assertThat(filter).isEqualTo(IncidentFilter.none());
        assertThat(filter.closedConstraint()).isNull();
        assertThat(filter.window(PRAGUE, TODAY)).isNull();
    }

    @Test
    void shouldNormalizeCase() {
        IncidentFilter filter = IncidentFilter.of("TODAY", " Closed ", " Kolín ", "fire", " 2025-03 ");

        assertThat(filter.day()).isEqualTo("today");
        assertThat(filter.status()).isEqualTo("closed");
        assertThat(filter.city()).isEqualTo("Kolín");
        assertThat(filter.month()).isEqualTo("2025-03");
        assertThat(filter.closedConstraint()).isTrue();
        assertThat(IncidentFilter.of(null, "open", null, null, null).closedConstraint()).isFalse();
    }

    @Test
    @DisplayName("Should select the local calendar day")
    void shouldSelectLocalDay() {
        TimeWindow yesterday = IncidentFilter.of("yesterday", null, null, null, null).window(PRAGUE, TODAY);

        assertThat(yesterday.from()).isEqualTo(Instant.parse("2025-03-13T23:00:00Z"));
        assertThat(yesterday.to()).isEqualTo(Instant.parse("2025-03-14T23:00:00Z"));
    }

    @Test
    @DisplayName("Should intersect day and month windows")
    void shouldIntersectDayAndMonth() {
        TimeWindow inside = IncidentFilter.of("today", null, null, null, "2025-03").window(PRAGUE, TODAY);
        TimeWindow disjoint = IncidentFilter.of("today", null, null, null, "2025-01").window(PRAGUE, TODAY);

        assertThat(inside.from()).isEqualTo(Instant.parse("2025-03-14T23:00:00Z"));
        assertThat(inside.to()).isEqualTo(Instant.parse("2025-03-15T23:00:00Z"));
        assertThat(disjoint.from()).isEqualTo(disjoint.to());
    }
}
