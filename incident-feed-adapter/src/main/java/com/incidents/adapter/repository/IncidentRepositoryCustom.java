package com.incidents.adapter.repository;

import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.IncidentFilter;
import com.incidents.adapter.model.TimeWindow;

import java.time.Instant;
import java.util.List;

/**
 * Field-level writes and filtered reads that go through MongoTemplate.
 * Every field-level write bumps the version so that a reconcile in flight re-merges on top of it.
 */
public interface IncidentRepositoryCustom {

    List<IncidentDocument> findFiltered(IncidentFilter filter, TimeWindow window, int limit);

    boolean updateDuration(String id, Integer durationMin, Instant now);

    boolean updateCoordinates(String id, double lat, double lon, Instant now);

    boolean clearCoordinates(String id, Instant now);

    /**
     * Clears every stored duration above the ceiling
     *
     * @return number of incidents changed
     */
    long clearDurationsAbove(int maxMinutes, Instant now);
}
