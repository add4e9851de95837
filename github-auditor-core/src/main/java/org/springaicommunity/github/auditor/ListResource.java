package org.springaicommunity.github.auditor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes a paginated GitHub list endpoint.
 *
 * @param path API path of the list, e.g. {@code /orgs/acme/repos}
 * @param query fixed query parameters sent with every page (e.g. {@code permission=admin})
 * @param organization organization the list belongs to, used in failure messages
 */
public record ListResource(String path, Map<String, String> query, String organization) {

	public ListResource {
		query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
	}

	public static ListResource of(String organization, String path) {
		return new ListResource(path, Map.of(), organization);
	}

	public ListResource withQuery(String name, String value) {
		Map<String, String> merged = new LinkedHashMap<>(query);
		merged.put(name, value);
		return new ListResource(path, merged, organization);
	}

}
