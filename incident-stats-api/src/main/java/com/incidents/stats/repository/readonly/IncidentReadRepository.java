package com.incidents.stats.repository.readonly;

import com.incidents.stats.model.readonly.IncidentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read-only repository for incidents.
 * Note: Write operations will fail with MongoDB authorization error.
 */
@Repository
public interface IncidentReadRepository extends MongoRepository<IncidentDocument, String> {

    /**
     * Fields the filtered counts read: status, type, city/place and event time
     */
    String COUNT_FIELDS = "{ 'closed': 1, 'eventType': 1, 'cityText': 1, 'placeText': 1, 'eventTime': 1, 'createdAt': 1 }";

    /**
     * Incidents whose event time (creation time when missing) falls in [from, to)
     */
    @Query(value = "{ $or: [ " +
           "  { 'eventTime': { $gte: ?0, $lt: ?1 } }, " +
           "  { 'eventTime': null, 'createdAt': { $gte: ?0, $lt: ?1 } } " +
           "] }", fields = COUNT_FIELDS)
    List<IncidentDocument> findByEventTimeWindow(Instant from, Instant to);

    /**
     * Every incident, projected to the fields the filtered counts read
     */
    @Query(value = "{}", fields = COUNT_FIELDS)
    List<IncidentDocument> findAllForCounts();

    /**
     * Location fields of every incident, for the unfiltered location ranking
     */
    @Query(value = "{}", fields = "{ 'cityText': 1, 'placeText': 1, 'lat': 1, 'lon': 1 }")
    List<IncidentDocument> findAllLocations();

    @Query("{ 'closedDetectedAt': { $gt: ?0 }, 'durationMin': { $gt: 0, $lte: ?1 } }")
    List<IncidentDocument> findClosedAfterWithDuration(Instant marker, int maxMinutes);
}
