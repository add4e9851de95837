package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base class for audit workflows providing the shared REST access and helpers for
 * dates and degraded-field bookkeeping.
 */
public abstract class AbstractAuditWorkflow<E, R> implements AuditWorkflow<E, R> {

	private static final DateTimeFormatter DAY_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE
		.withZone(ZoneOffset.UTC);

	protected final RestService restService;

	protected final Clock clock;

	protected AbstractAuditWorkflow(RestService restService, Clock clock) {
		this.restService = restService;
		this.clock = clock;
	}

	/**
	 * Names of the non-archived repositories of the organization.
	 */
	protected List<String> activeRepositoryNames(String organization) {
		return restService.listOrganizationRepositories(organization)
			.stream()
			.filter(repo -> !JsonNodeUtils.getBoolean(repo, "archived", false))
			.map(repo -> JsonNodeUtils.getString(repo, "name", ""))
			.collect(Collectors.toList());
	}

	protected static String formatDay(Instant instant) {
		return DAY_FORMATTER.format(instant);
	}

	protected long daysSince(Instant instant) {
		return Duration.between(instant, clock.instant()).toDays();
	}

	/**
	 * Names of the given lookups that were degraded, in insertion order.
	 */
	protected static List<String> degradedFields(Map<String, Lookup<?>> lookups) {
		List<String> degraded = new ArrayList<>();
		lookups.forEach((field, lookup) -> {
			if (lookup.isDegraded()) {
				degraded.add(field);
			}
		});
		return List.copyOf(degraded);
	}

	protected static Map<String, Lookup<?>> fields() {
		return new LinkedHashMap<>();
	}

	protected static String joinTopics(JsonNode repo) {
		return JsonNodeUtils.getArray(repo, "topics")
			.stream()
			.map(JsonNode::asText)
			.collect(Collectors.joining(", "));
	}

}
