package com.incidents.adapter.service;

import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.exception.ResourceNotFoundException;
import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.IncidentFilter;
import com.incidents.adapter.model.TimeWindow;
import com.incidents.adapter.repository.IncidentRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Filtered reads over the incident store
 */
@Service
public class IncidentQueryService {

    public static final int DEFAULT_LIMIT = 400;
    public static final int MAX_LIMIT = 2000;

    private final IncidentRepository incidentRepository;
    private final ZoneId zone;
    private final Clock clock;

    public IncidentQueryService(IncidentRepository incidentRepository, IncidentProperties properties, Clock clock) {
        this.incidentRepository = incidentRepository;
        this.zone = properties.getRegion().getZone();
        this.clock = clock;
    }

    /**
     * Newest first by event time.
     *
     * @param limit capped to 1..2000; null means the default of 400
     */
    public List<IncidentDocument> list(IncidentFilter filter, Integer limit) {
        int bounded = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        TimeWindow window = filter.window(zone, LocalDate.now(clock.withZone(zone)));
        return incidentRepository.findFiltered(filter, window, bounded);
    }

    public IncidentDocument get(String id) {
        return incidentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Incident", id));
    }
}
