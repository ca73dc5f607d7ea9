package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.exception.ConcurrentObservationException;
import com.incidents.adapter.exception.InvalidObservationException;
import com.incidents.adapter.exception.StoreUnavailableException;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.Observation;
import com.incidents.adapter.repository.IncidentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IncidentReconciler")
class IncidentReconcilerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    @Mock
    private IncidentRepository incidentRepository;

    private IncidentMerger merger;
    private IncidentReconciler reconciler;

    @BeforeEach
    void setUp() {
        IncidentProperties properties = new IncidentProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        merger = new IncidentMerger(properties);
        reconciler = new IncidentReconciler(incidentRepository, merger,
                new DurationCalculator(properties, clock), clock);
    }

    private void saveReturnsArgument() {
        when(incidentRepository.save(any(IncidentDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Should compute 90 minutes for an incident reported closed with start and end")
    void shouldComputeDurationOnFirstClosure() {
        when(incidentRepository.findById("E1")).thenReturn(Optional.empty());
        saveReturnsArgument();

        IncidentDocument saved = reconciler.reconcile(Observation.builder("E1")
                .startTimeIso("2025-01-01T10:00:00Z")
                .endTimeIso("2025-01-01T11:30:00Z")
                .closed(true)
                .build());

        assertThat(saved.isClosed()).isTrue();
        assertThat(saved.getDurationMin()).isEqualTo(90);
        assertThat(saved.getClosedDetectedAt()).isEqualTo(NOW);
        assertThat(saved.getEndTimeIso()).isEqualTo("2025-01-01T11:30:00Z");
    }

    @Test
    @DisplayName("Should compute 90 minutes when the start comes with the open report and the end with the closing one")
    void shouldCombineStoredStartWithClosingEnd() {
        Map<String, IncidentDocument> store = new HashMap<>();
        when(incidentRepository.findById("E1")).thenAnswer(inv -> Optional.ofNullable(store.get("E1")));
        when(incidentRepository.save(any(IncidentDocument.class))).thenAnswer(inv -> {
            IncidentDocument doc = inv.getArgument(0);
            store.put(doc.getId(), doc);
            return doc;
        });

        IncidentDocument open = reconciler.reconcile(Observation.builder("E1")
                .startTimeIso("2025-01-01T10:00:00Z")
                .build());
        assertThat(open.isClosed()).isFalse();
        assertThat(open.getDurationMin()).isNull();

        IncidentDocument closed = reconciler.reconcile(Observation.builder("E1")
                .endTimeIso("2025-01-01T11:30:00Z")
                .closed(true)
                .build());

        assertThat(closed.isClosed()).isTrue();
        assertThat(closed.getStartTimeIso()).isEqualTo("2025-01-01T10:00:00Z");
        assertThat(closed.getEndTimeIso()).isEqualTo("2025-01-01T11:30:00Z");
        assertThat(closed.getDurationMin()).isEqualTo(90);
        assertThat(closed.getClosedDetectedAt()).isEqualTo(NOW);

        IncidentProperties properties = new IncidentProperties();
        Clock later = Clock.fixed(NOW.plusSeconds(600), ZoneOffset.UTC);
        IncidentReconciler laterReconciler = new IncidentReconciler(incidentRepository, merger,
                new DurationCalculator(properties, later), later);

        IncidentDocument repeated = laterReconciler.reconcile(Observation.builder("E1").closed(true).build());

        assertThat(repeated.getClosedDetectedAt()).isEqualTo(NOW);
        assertThat(repeated.getDurationMin()).isEqualTo(90);
        assertThat(repeated.getEndTimeIso()).isEqualTo("2025-01-01T11:30:00Z");
    }

    @Test
    @DisplayName("Should measure from stored start to now when the closing report has no end")
    void shouldUseStoredStartAndNow() {
        IncidentDocument stored = merger.merge(null, Observation.builder("E2")
                .startTimeIso("2025-01-01T11:15:00Z").build().normalized(), NOW.minusSeconds(2700));
        stored.setVersion(0L);
        when(incidentRepository.findById("E2")).thenReturn(Optional.of(stored));
        saveReturnsArgument();

        IncidentDocument saved = reconciler.reconcile(Observation.builder("E2").closed(true).build());

        assertThat(saved.getDurationMin()).isEqualTo(45);
        assertThat(saved.getEndTimeIso()).isEqualTo(NOW.toString());
    }

    @Test
    @DisplayName("Should leave duration unknown when the computed value is implausible")
    void shouldLeaveImplausibleDurationUnknown() {
        when(incidentRepository.findById("E3")).thenReturn(Optional.empty());
        saveReturnsArgument();

        IncidentDocument saved = reconciler.reconcile(Observation.builder("E3")
                .startTimeIso("2024-12-01T00:00:00Z")
                .endTimeIso("2025-01-01T11:00:00Z")
                .closed(true)
                .build());

        assertThat(saved.isClosed()).isTrue();
        assertThat(saved.getDurationMin()).isNull();
    }

    @Test
    @DisplayName("Should not recompute duration for an already closed incident")
    void shouldKeepDurationAfterClosure() {
        IncidentDocument stored = merger.merge(null, Observation.builder("E4").closed(true).durationMin(30)
                .build().normalized(), NOW.minusSeconds(600));
        stored.setVersion(1L);
        when(incidentRepository.findById("E4")).thenReturn(Optional.of(stored));
        saveReturnsArgument();

        IncidentDocument saved = reconciler.reconcile(Observation.builder("E4").closed(true)
                .startTimeIso("2025-01-01T08:00:00Z").build());

        assertThat(saved.getDurationMin()).isEqualTo(30);
        assertThat(saved.getClosedDetectedAt()).isEqualTo(NOW.minusSeconds(600));
    }

    @Test
    @DisplayName("Should reject an observation without id and write nothing")
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> reconciler.reconcile(Observation.builder("   ").title("x").build()))
                .isInstanceOf(InvalidObservationException.class);
        assertThatThrownBy(() -> reconciler.reconcile(null))
                .isInstanceOf(InvalidObservationException.class);

        verifyNoInteractions(incidentRepository);
    }

    @Test
    @DisplayName("Should re-read and re-merge after losing the write to a concurrent writer")
    void shouldRetryOnConflict() {
        IncidentDocument winner = merger.merge(null, Observation.builder("E5").title("winner")
                .cityText("Kolín").build().normalized(), NOW);
        winner.setVersion(0L);
        when(incidentRepository.findById("E5"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(incidentRepository.save(any(IncidentDocument.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"))
                .thenAnswer(inv -> inv.getArgument(0));

        IncidentDocument saved = reconciler.reconcile(Observation.builder("E5").title("late").build());

        assertThat(saved.getTitle()).isEqualTo("late");
        assertThat(saved.getCityText()).isEqualTo("Kolín");
        assertThat(saved.getVersion()).isEqualTo(0L);
        verify(incidentRepository, times(2)).findById("E5");
        verify(incidentRepository, times(2)).save(any(IncidentDocument.class));
    }

    @Test
    @DisplayName("Should give up after the bounded number of conflicting attempts")
    void shouldGiveUpAfterMaxAttempts() {
        when(incidentRepository.findById("E6")).thenReturn(Optional.empty());
        when(incidentRepository.save(any(IncidentDocument.class)))
                .thenThrow(new OptimisticLockingFailureException("version mismatch"));

        assertThatThrownBy(() -> reconciler.reconcile(Observation.builder("E6").build()))
                .isInstanceOf(ConcurrentObservationException.class)
                .hasCauseInstanceOf(OptimisticLockingFailureException.class);

        verify(incidentRepository, times(IncidentReconciler.MAX_ATTEMPTS)).save(any(IncidentDocument.class));
    }

    @Test
    @DisplayName("Should surface store outages without retrying")
    void shouldNotRetryStoreOutage() {
        when(incidentRepository.findById("E7")).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> reconciler.reconcile(Observation.builder("E7").build()))
                .isInstanceOf(StoreUnavailableException.class);

        verify(incidentRepository, times(1)).findById("E7");
        verify(incidentRepository, never()).save(any(IncidentDocument.class));
    }
}
