package com.stealthradar.monitor.state;

import com.stealthradar.domain.StateEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link StateStore} over the monitor_state collection. Expired entries are hidden on read even before the
 * TTL monitor deletes them.
 */
@Component
@RequiredArgsConstructor
public class MongoStateStore implements StateStore {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public Optional<String> get(String key) {
        return live(key).map(StateEntry::getValue);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        Update update = new Update()
                .set("value", value)
                .set("updatedAt", now);
        if (ttl != null) {
            update.set("expireAt", now.plus(ttl));
        } else {
            update.unset("expireAt");
        }
        try {
            mongoTemplate.upsert(byKey(key), update, StateEntry.class);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to set " + key, e);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        Instant now = clock.instant();
        Update update = new Update()
                .inc("counter", 1L)
                .set("updatedAt", now);
        if (ttl != null) {
            update.setOnInsert("expireAt", now.plus(ttl));
        }
        try {
            StateEntry entry = mongoTemplate.findAndModify(byKey(key), update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), StateEntry.class);
            return entry != null && entry.getCounter() != null ? entry.getCounter() : 0L;
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to increment " + key, e);
        }
    }

    @Override
    public long getCounter(String key) {
        return live(key)
                .map(StateEntry::getCounter)
                .orElse(0L);
    }

    private Optional<StateEntry> live(String key) {
        StateEntry entry;
        try {
            entry = mongoTemplate.findById(key, StateEntry.class);
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to read " + key, e);
        }
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private static Query byKey(String key) {
        return new Query(where("_id").is(key));
    }
}
