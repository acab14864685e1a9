package org.javai.rollout.sink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A {@link ResultStore} kept in process memory. Expired entries are dropped when read.
 */
public class InMemoryResultStore implements ResultStore {

	private record Stored(String value, Instant expiresAt) {}

	private final ConcurrentHashMap<String, Stored> entries = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryResultStore() {
		this(Clock.systemUTC());
	}

	public InMemoryResultStore(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Override
	public void put(String key, String value, Duration ttl) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
		entries.put(key, new Stored(value, clock.instant().plus(ttl)));
	}

	@Override
	public Optional<String> get(String key) {
		Stored entry = entries.get(key);
		if (entry == null) {
			return Optional.empty();
		}
		if (!clock.instant().isBefore(entry.expiresAt())) {
			entries.remove(key, entry);
			return Optional.empty();
		}
		return Optional.of(entry.value());
	}

	/**
	 * Returns the keys of all entries that have not expired.
	 */
	public Set<String> keys() {
		Instant now = clock.instant();
		return entries.entrySet().stream()
				.filter(e -> now.isBefore(e.getValue().expiresAt()))
				.map(Map.Entry::getKey)
				.collect(Collectors.toUnmodifiableSet());
	}
}
