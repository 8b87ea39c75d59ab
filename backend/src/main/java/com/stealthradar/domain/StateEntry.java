package com.stealthradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One key of the monitor's key/value state: a scalar {@code value} or an atomic {@code counter}.
 * Mongo's TTL monitor removes the document once {@code expireAt} has passed.
 */
@Document(collection = "monitor_state")
@NoArgsConstructor
@Getter
@Setter
public class StateEntry {

    @Id
    private String key;
    private String value;
    private Long counter;
    @Indexed(name = "expire_at_ttl", expireAfter = "0s")
    private Instant expireAt;
    private Instant updatedAt;

    public boolean isExpired(Instant now) {
        return expireAt != null && !expireAt.isAfter(now);
    }
}
