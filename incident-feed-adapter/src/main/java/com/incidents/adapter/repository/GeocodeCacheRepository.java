package com.incidents.adapter.repository;

import com.incidents.adapter.model.GeocodeCacheEntry;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface GeocodeCacheRepository extends MongoRepository<GeocodeCacheEntry, String> {
}
