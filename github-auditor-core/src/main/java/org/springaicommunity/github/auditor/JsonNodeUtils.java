package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for reading GitHub JSON where fields may be missing or {@code null}.
 */
public final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	public static String getString(JsonNode node, String field, String defaultValue) {
		return getString(node, field).orElse(defaultValue);
	}

	public static @Nullable String getNullableString(JsonNode node, String field) {
		return getString(node, field).orElse(null);
	}

	public static int getInt(JsonNode node, String field, int defaultValue) {
		JsonNode target = node.path(field);
		return target.isNumber() ? target.asInt() : defaultValue;
	}

	public static boolean getBoolean(JsonNode node, String field, boolean defaultValue) {
		JsonNode target = node.path(field);
		return target.isBoolean() ? target.asBoolean() : defaultValue;
	}

	public static Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(Instant.parse(str));
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse datetime: {}", str);
				return Optional.empty();
			}
		});
	}

	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
