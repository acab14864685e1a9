package org.javai.rollout.sink;

import org.javai.rollout.ComparisonResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Stores each record as JSON under {@code experiment:result:<uuid>} for later analysis.
 * Entries expire after seven days unless another time-to-live is given.
 *
 * <p>Storage is synchronous; wrap this sink in an {@link AsyncResultSink} to keep slow
 * stores off the caller's path. Store failures are logged and the record dropped.
 */
public class StoringResultSink implements ResultSink {

	public static final String KEY_PREFIX = "experiment:result:";
	public static final Duration DEFAULT_TTL = Duration.ofDays(7);

	private static final Logger log = LoggerFactory.getLogger(StoringResultSink.class);

	private final ResultStore store;
	private final Duration ttl;
	private final Supplier<UUID> ids;

	public StoringResultSink(ResultStore store) {
		this(store, DEFAULT_TTL);
	}

	public StoringResultSink(ResultStore store, Duration ttl) {
		this(store, ttl, UUID::randomUUID);
	}

	StoringResultSink(ResultStore store, Duration ttl, Supplier<UUID> ids) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
		this.ids = Objects.requireNonNull(ids, "ids must not be null");
		if (ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive, was " + ttl);
		}
	}

	@Override
	public void publish(ComparisonResult result) {
		String key = KEY_PREFIX + ids.get();
		try {
			store.put(key, ComparisonJson.write(result), ttl);
		} catch (Exception e) {
			log.warn("Failed to store result of experiment [{}] under {}: {}",
					result.experimentName(), key, e.getMessage());
		}
	}
}
