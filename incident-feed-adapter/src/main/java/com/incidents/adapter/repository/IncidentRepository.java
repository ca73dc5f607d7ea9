package com.incidents.adapter.repository;

import com.incidents.adapter.model.IncidentDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface IncidentRepository extends MongoRepository<IncidentDocument, String>, IncidentRepositoryCustom {

    /**
     * Closed incidents with a detected closure but no usable duration (store-wide repair)
     */
    @Query("{ 'closed': true, 'closedDetectedAt': { $ne: null }, " +
           "  $or: [ { 'durationMin': null }, { 'durationMin': { $lte: 0 } } ] }")
    List<IncidentDocument> findClosedMissingDuration(Pageable pageable);

    /**
     * Incidents whose stored coordinates fall outside the given rectangle
     */
    @Query("{ 'lat': { $ne: null }, 'lon': { $ne: null }, " +
           "  $or: [ { 'lat': { $lt: ?0 } }, { 'lat': { $gt: ?1 } }, { 'lon': { $lt: ?2 } }, { 'lon': { $gt: ?3 } } ] }")
    List<IncidentDocument> findWithCoordinatesOutside(double minLat, double maxLat, double minLon, double maxLon,
                                                      Pageable pageable);
}
