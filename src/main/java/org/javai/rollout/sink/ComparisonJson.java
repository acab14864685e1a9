package org.javai.rollout.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextValue;
import org.javai.rollout.ErrorKind;
import org.javai.rollout.Observation;

import java.util.Map;

/**
 * Renders comparison records as JSON.
 *
 * <p>Observation values are converted with Jackson's default mapping. A value Jackson
 * cannot map is written as its {@code toString()}.
 */
public final class ComparisonJson {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private ComparisonJson() {}

	public static ObjectNode toJson(ComparisonResult result) {
		ObjectNode root = MAPPER.createObjectNode();
		root.put("experiment", result.experimentName());
		root.put("matched", result.matched());
		root.set("control", observation(result.control()));
		root.set("candidates", MAPPER.createArrayNode().addAll(
				result.candidates().stream().map(ComparisonJson::observation).toList()));
		root.set("contexts", contexts(result.contexts()));
		return root;
	}

	public static String write(ComparisonResult result) {
		try {
			return MAPPER.writeValueAsString(toJson(result));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize experiment " + result.experimentName(), e);
		}
	}

	static ObjectNode observation(Observation<Object> observation) {
		ObjectNode node = MAPPER.createObjectNode();
		node.put("name", observation.name());
		node.put("durationMs", observation.durationNanos() / 1_000_000.0);
		if (observation.failed()) {
			ErrorKind error = observation.error().orElseThrow();
			ObjectNode errorNode = node.putObject("error");
			errorNode.put("type", error.type());
			errorNode.put("fingerprint", error.fingerprint());
			errorNode.put("message", error.message());
		} else {
			node.set("value", value(observation.value()));
		}
		return node;
	}

	private static JsonNode value(Object value) {
		if (value == null) {
			return NullNode.getInstance();
		}
		try {
			return MAPPER.valueToTree(value);
		} catch (IllegalArgumentException e) {
			return TextNode.valueOf(String.valueOf(value));
		}
	}

	private static ObjectNode contexts(Map<String, ContextValue> contexts) {
		ObjectNode node = MAPPER.createObjectNode();
		contexts.forEach((key, value) -> {
			if (value instanceof ContextValue.Integral integral) {
				node.put(key, integral.value());
			} else if (value instanceof ContextValue.Decimal decimal) {
				node.put(key, decimal.value());
			} else if (value instanceof ContextValue.Flag flag) {
				node.put(key, flag.value());
			} else {
				node.put(key, value.asText());
			}
		});
		return node;
	}
}
