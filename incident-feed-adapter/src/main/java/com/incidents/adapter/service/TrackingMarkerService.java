package com.incidents.adapter.service;

import com.incidents.adapter.model.AppSetting;
import com.incidents.adapter.repository.AppSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Owns the tracking marker: the instant from which closure durations are trusted.
 * Written once, on the first startup against an empty store, and never changed afterwards.
 */
@Service
public class TrackingMarkerService {

    private static final Logger log = LoggerFactory.getLogger(TrackingMarkerService.class);

    private final MongoTemplate mongoTemplate;
    private final AppSettingRepository appSettingRepository;
    private final Clock clock;

    public TrackingMarkerService(MongoTemplate mongoTemplate, AppSettingRepository appSettingRepository, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.appSettingRepository = appSettingRepository;
        this.clock = clock;
    }

    /**
     * Inserts the marker if absent. Concurrent starters race on a single upsert; only the first insert sets a value.
     *
     * @return the marker as stored after the call
     */
    public Instant ensureMarker() {
        Instant now = clock.instant();
        Query query = Query.query(Criteria.where("_id").is(AppSetting.TRACKING_STARTED_AT));
        Update update = new Update()
                .setOnInsert("value", now.toString())
                .setOnInsert("createdAt", now)
                .setOnInsert("updatedAt", now);
        boolean inserted = mongoTemplate.upsert(query, update, AppSetting.class).getUpsertedId() != null;
        if (inserted) {
            log.info("Tracking marker set to {}", now);
            return now;
        }
        return getMarker().orElse(now);
    }

    public Optional<Instant> getMarker() {
        return appSettingRepository.findById(AppSetting.TRACKING_STARTED_AT)
                .map(AppSetting::getValue)
                .flatMap(TrackingMarkerService::parse);
    }

    private static Optional<Instant> parse(String value) {
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.warn("Stored tracking marker '{}' is not an ISO instant", value);
            return Optional.empty();
        }
    }
}
