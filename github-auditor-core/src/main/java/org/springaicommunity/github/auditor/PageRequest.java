package org.springaicommunity.github.auditor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One page of a {@link ListResource}. Built fresh for every call.
 *
 * @param resource the list being paged
 * @param page 1-based page index
 * @param perPage page size
 */
public record PageRequest(ListResource resource, int page, int perPage) {

	public static final int MAX_PAGE_SIZE = 100;

	public PageRequest {
		if (page < 1) {
			throw new IllegalArgumentException("page must be >= 1 (got: " + page + ")");
		}
		if (perPage < 1 || perPage > MAX_PAGE_SIZE) {
			throw new IllegalArgumentException(
					"perPage must be between 1 and " + MAX_PAGE_SIZE + " (got: " + perPage + ")");
		}
	}

	public static PageRequest first(ListResource resource, int perPage) {
		return new PageRequest(resource, 1, perPage);
	}

	public PageRequest next() {
		return new PageRequest(resource, page + 1, perPage);
	}

	/**
	 * Query parameters for this page: the resource's own parameters followed by
	 * {@code per_page} and {@code page}.
	 */
	public Map<String, String> toQuery() {
		Map<String, String> query = new LinkedHashMap<>(resource.query());
		query.put("per_page", String.valueOf(perPage));
		query.put("page", String.valueOf(page));
		return query;
	}

}
