package org.javai.rollout.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.rollout.ComparisonResult;
import org.javai.rollout.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class StoringResultSinkTest {

	private static final UUID ID = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

	private MutableClock clock;
	private InMemoryResultStore store;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(SinkFixtures.NOW);
		store = new InMemoryResultStore(clock);
	}

	@Test
	void publish_storesJsonUnderExperimentKey() throws Exception {
		StoringResultSink sink = new StoringResultSink(store, StoringResultSink.DEFAULT_TTL, () -> ID);

		sink.publish(SinkFixtures.candidateFailed("pricing"));

		String key = "experiment:result:" + ID;
		assertThat(store.keys()).containsExactly(key);
		JsonNode json = new ObjectMapper().readTree(store.get(key).orElseThrow());
		assertThat(json.get("experiment").asText()).isEqualTo("pricing");
		assertThat(json.get("matched").asBoolean()).isFalse();
		assertThat(json.get("control").get("value").asText()).isEqualTo("A");
		assertThat(json.get("control").get("durationMs").asDouble()).isEqualTo(1.5);
		JsonNode candidate = json.get("candidates").get(0);
		assertThat(candidate.get("name").asText()).isEqualTo("candidate");
		assertThat(candidate.has("value")).isFalse();
		assertThat(candidate.get("error").get("type").asText()).isEqualTo("java.lang.IllegalStateException");
		assertThat(json.get("contexts").get("rollout_percentage").asInt()).isEqualTo(25);
		assertThat(json.get("contexts").get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
	}

	@Test
	void publish_entriesExpireAfterSevenDays() {
		StoringResultSink sink = new StoringResultSink(store, StoringResultSink.DEFAULT_TTL, () -> ID);
		sink.publish(SinkFixtures.matched("pricing"));
		String key = StoringResultSink.KEY_PREFIX + ID;

		clock.advance(Duration.ofDays(7).minusSeconds(1));
		assertThat(store.get(key)).isPresent();

		clock.advance(Duration.ofSeconds(1));
		assertThat(store.get(key)).isEmpty();
	}

	@Test
	void publish_eachRecordGetsItsOwnKey() {
		StoringResultSink sink = new StoringResultSink(store);

		sink.publish(SinkFixtures.matched("pricing"));
		sink.publish(SinkFixtures.matched("pricing"));

		assertThat(store.keys()).hasSize(2).allMatch(key -> key.startsWith(StoringResultSink.KEY_PREFIX));
	}

	@Test
	void publish_failingStore_contained() {
		StoringResultSink sink = new StoringResultSink(new ResultStore() {
			@Override
			public void put(String key, String value, Duration ttl) {
				throw new IllegalStateException("store down");
			}

			@Override
			public Optional<String> get(String key) {
				return Optional.empty();
			}
		});

		assertThatCode(() -> sink.publish(SinkFixtures.matched("pricing"))).doesNotThrowAnyException();
	}

	@Test
	void constructor_rejectsNonPositiveTtl() {
		assertThatThrownBy(() -> new StoringResultSink(store, Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void json_unmappableValueWrittenAsText() {
		Object opaque = new Object() {
			@Override
			public String toString() {
				return "opaque";
			}
		};
		ComparisonResult result = new ComparisonResult("exp",
				Observation.success("control", opaque, 0),
				List.of(Observation.success("candidate", opaque, 0)),
				true,
				null);

		assertThat(ComparisonJson.toJson(result).get("control").get("value").asText()).isEqualTo("opaque");
	}

	private static final class MutableClock extends Clock {
		private Instant now;

		MutableClock(Instant now) {
			this.now = now;
		}

		void advance(Duration duration) {
			now = now.plus(duration);
		}

		@Override
		public ZoneOffset getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}
	}
}
