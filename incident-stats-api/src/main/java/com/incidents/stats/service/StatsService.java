package com.incidents.stats.service;

import com.incidents.stats.config.StatsProperties;
import com.incidents.stats.dto.*;
import com.incidents.stats.model.EventWindow;
import com.incidents.stats.model.StatsFilter;
import com.incidents.stats.model.readonly.AppSettingDocument;
import com.incidents.stats.model.readonly.IncidentDocument;
import com.incidents.stats.repository.readonly.AppSettingReadRepository;
import com.incidents.stats.repository.readonly.IncidentReadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Computes the dashboard aggregates over the reconciled incidents.
 */
@Service
public class StatsService {

    private static final Logger log = LoggerFactory.getLogger(StatsService.class);

    static final String OTHER_TYPE = "other";

    private final IncidentReadRepository incidentRepository;
    private final AppSettingReadRepository appSettingRepository;
    private final StatsProperties properties;
    private final Clock clock;

    public StatsService(IncidentReadRepository incidentRepository,
                        AppSettingReadRepository appSettingRepository,
                        StatsProperties properties,
                        Clock clock) {
        this.incidentRepository = incidentRepository;
        this.appSettingRepository = appSettingRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public StatsResponse getStats(StatsFilter filter) {
        ZoneId zone = properties.getZone();
        LocalDate today = LocalDate.now(clock.withZone(zone));

        List<IncidentDocument> filtered = loadCandidates(filter, zone, today).stream()
                .filter(incident -> filter.matches(incident, zone, today))
                .toList();

        long closed = filtered.stream().filter(IncidentDocument::isClosed).count();
        OpenClosed openVsClosed = new OpenClosed(filtered.size() - closed, closed);

        Instant trackingStartedAt = getTrackingStartedAt();

        log.debug("Stats for {}: {} incidents", filter, filtered.size());
        return new StatsResponse(
                filter,
                openVsClosed,
                byDay(filtered, zone),
                byType(filtered),
                topLocations(),
                longest(filter, trackingStartedAt, zone),
                trackingStartedAt
        );
    }

    /**
     * The adapter's tracking marker; now when it was never written or is unreadable
     */
    public Instant getTrackingStartedAt() {
        return appSettingRepository.findById(AppSettingDocument.TRACKING_STARTED_AT)
                .map(AppSettingDocument::getValue)
                .flatMap(StatsService::parseInstant)
                .orElseGet(clock::instant);
    }

    private List<IncidentDocument> loadCandidates(StatsFilter filter, ZoneId zone, LocalDate today) {
        EventWindow window = filter.window(zone, today);
        return window == null
                ? incidentRepository.findAllForCounts()
                : incidentRepository.findByEventTimeWindow(window.from(), window.to());
    }

    private List<DayCount> byDay(List<IncidentDocument> incidents, ZoneId zone) {
        Map<LocalDate, Long> counts = incidents.stream()
                .map(IncidentDocument::resolveEventTime)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(eventTime -> eventTime.atZone(zone).toLocalDate(), Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<LocalDate, Long>comparingByKey().reversed())
                .limit(properties.getByDayLimit())
                .map(e -> new DayCount(e.getKey(), e.getValue()))
                .toList();
    }

    private List<TypeCount> byType(List<IncidentDocument> incidents) {
        Map<String, Long> counts = incidents.stream()
                .collect(Collectors.groupingBy(StatsService::typeOf, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .map(e -> new TypeCount(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Over every stored incident regardless of the filter
     */
    private List<LocationCount> topLocations() {
        Map<String, Long> counts = incidentRepository.findAllLocations().stream()
                .filter(incident -> !incident.hasCoordinates() || properties.inRegion(incident.getLat(), incident.getLon()))
                .collect(Collectors.groupingBy(IncidentDocument::locationLabel, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(properties.getTopLocationsLimit())
                .map(e -> new LocationCount(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Closed after the tracking marker with a plausible duration; status and day filters do not apply
     */
    private List<LongestIncident> longest(StatsFilter filter, Instant trackingStartedAt, ZoneId zone) {
        int maxMinutes = properties.getMaxDurationMinutes();
        return incidentRepository.findClosedAfterWithDuration(trackingStartedAt, maxMinutes).stream()
                .filter(incident -> incident.getClosedDetectedAt() != null
                        && incident.getClosedDetectedAt().isAfter(trackingStartedAt))
                .filter(incident -> incident.getDurationMin() != null
                        && incident.getDurationMin() > 0
                        && incident.getDurationMin() <= maxMinutes)
                .filter(incident -> filter.matchesIgnoringStatusAndDay(incident, zone))
                .sorted(Comparator.comparing(IncidentDocument::getDurationMin, Comparator.reverseOrder())
                        .thenComparing(IncidentDocument::getClosedDetectedAt, Comparator.reverseOrder()))
                .limit(properties.getLongestLimit())
                .map(LongestIncident::from)
                .toList();
    }

    private static String typeOf(IncidentDocument incident) {
        String type = incident.getEventType();
        return type == null || type.isBlank() ? OTHER_TYPE : type;
    }

    private static Optional<Instant> parseInstant(String value) {
        try {
            return Optional.of(Instant.parse(value.trim()));
        } catch (DateTimeParseException e) {
            log.warn("Tracking marker '{}' is not an ISO instant, using now", value);
            return Optional.empty();
        }
    }
}
