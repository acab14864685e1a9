package org.javai.rollout.sink;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value storage with expiry, e.g. a Redis client, used by {@link StoringResultSink}.
 */
public interface ResultStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);
}
