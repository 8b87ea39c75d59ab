package com.stealthradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of StealthUserRepositoryCustom using MongoTemplate.updateFirst.
 */
@Repository
@RequiredArgsConstructor
public class StealthUserRepositoryImpl implements StealthUserRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean updateLastStealthNotification(String userId, Instant at) {
        Query query = new Query(where("userId").is(userId));
        Update update = new Update()
                .set("lastStealthNotification", at)
                .set("lastUpdated", Instant.now());
        return mongoTemplate.updateFirst(query, update, StealthUser.class).getModifiedCount() > 0;
    }
}
