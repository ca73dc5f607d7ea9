package com.incidents.adapter.repository;

import com.incidents.adapter.model.IncidentDocument;
import com.incidents.adapter.model.IncidentFilter;
import com.incidents.adapter.model.TimeWindow;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class IncidentRepositoryImpl implements IncidentRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public IncidentRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<IncidentDocument> findFiltered(IncidentFilter filter, TimeWindow window, int limit) {
        List<Criteria> clauses = new ArrayList<>();

        if (filter.type() != null) {
            clauses.add(Criteria.where("eventType").is(filter.type()));
        }
        if (filter.city() != null) {
            Pattern contains = Pattern.compile(Pattern.quote(filter.city()),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            clauses.add(new Criteria().orOperator(
                    Criteria.where("cityText").regex(contains),
                    Criteria.where("placeText").regex(contains)));
        }
        Boolean closed = filter.closedConstraint();
        if (closed != null) {
            clauses.add(Criteria.where("closed").is(closed));
        }
        if (window != null) {
            clauses.add(Criteria.where("eventTime").gte(window.from()).lt(window.to()));
        }

        Query query = clauses.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(clauses.toArray(new Criteria[0])));
        query.with(Sort.by(Sort.Order.desc("eventTime"), Sort.Order.desc("createdAt")));
        query.limit(limit);
        return mongoTemplate.find(query, IncidentDocument.class);
    }

    @Override
    public boolean updateDuration(String id, Integer durationMin, Instant now) {
        Update update = new Update().set("durationMin", durationMin);
        return apply(id, update, now);
    }

    @Override
    public boolean updateCoordinates(String id, double lat, double lon, Instant now) {
        Update update = new Update().set("lat", lat).set("lon", lon);
        return apply(id, update, now);
    }

    @Override
    public boolean clearCoordinates(String id, Instant now) {
        Update update = new Update().unset("lat").unset("lon");
        return apply(id, update, now);
    }

    @Override
    public long clearDurationsAbove(int maxMinutes, Instant now) {
        Query query = new Query(Criteria.where("durationMin").gt(maxMinutes));
        Update update = new Update().unset("durationMin").set("updatedAt", now).inc("version", 1);
        return mongoTemplate.updateMulti(query, update, IncidentDocument.class).getModifiedCount();
    }

    private boolean apply(String id, Update update, Instant now) {
        update.set("updatedAt", now).inc("version", 1);
        return mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(id)), update, IncidentDocument.class)
                .getMatchedCount() > 0;
    }
}
