package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Items gathered by a lenient pagination run.
 *
 * @param items items from every page read before stopping
 * @param complete true when pagination ended on an empty page, false when a page failed
 * @param failedStatus status of the failing page, or 0 when complete
 */
public record PageResult(List<JsonNode> items, boolean complete, int failedStatus) {

	public static PageResult complete(List<JsonNode> items) {
		return new PageResult(List.copyOf(items), true, 0);
	}

	public static PageResult interrupted(List<JsonNode> items, int status) {
		return new PageResult(List.copyOf(items), false, status);
	}

}
