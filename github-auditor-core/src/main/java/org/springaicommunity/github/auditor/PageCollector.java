package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads every page of a GitHub list endpoint.
 *
 * <p>
 * GitHub does not reliably report a total count for list endpoints, so the end of data is
 * the first page that comes back empty. Pages are requested strictly one after another:
 * page {@code n + 1} is only requested once page {@code n} has returned.
 */
public class PageCollector {

	private static final Logger logger = LoggerFactory.getLogger(PageCollector.class);

	public static final int DEFAULT_PAGE_SIZE = 100;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public PageCollector(GitHubClient client, ObjectMapper objectMapper) {
		this(client, objectMapper, DEFAULT_PAGE_SIZE);
	}

	public PageCollector(GitHubClient client, ObjectMapper objectMapper, int pageSize) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	/**
	 * Collect every item of the list. Any page answering with something other than 200
	 * aborts the whole collection.
	 * @param resource the list to read
	 * @return all items, in page order
	 * @throws AuditException on 401 (invalid credentials), 404 (unknown organization), any
	 * other non-200 status, or a 200 page whose body is not a JSON array
	 */
	public List<JsonNode> collectAll(ListResource resource) {
		List<JsonNode> items = new ArrayList<>();
		PageRequest request = PageRequest.first(resource, pageSize);

		while (true) {
			GitHubResponse response = client.get(resource.path(), request.toQuery());
			if (!response.isOk()) {
				logger.error("Listing {} failed on page {} with status {}", resource.path(), request.page(),
						response.statusCode());
				throw toFailure(resource, response);
			}
			List<JsonNode> page = parseStrictPage(resource, request, response);
			if (page.isEmpty()) {
				break;
			}
			items.addAll(page);
			request = request.next();
		}

		logger.debug("Collected {} items from {} in {} pages", items.size(), resource.path(), request.page());
		return items;
	}

	/**
	 * Collect items until the list ends or a page fails. Used inside audit units where a
	 * failing sub-request degrades the unit instead of aborting the run.
	 * @param resource the list to read
	 * @return the items gathered and whether the list was read to the end
	 */
	public PageResult collectAvailable(ListResource resource) {
		List<JsonNode> items = new ArrayList<>();
		PageRequest request = PageRequest.first(resource, pageSize);

		while (true) {
			GitHubResponse response = client.get(resource.path(), request.toQuery());
			if (!response.isOk()) {
				logger.debug("Listing {} stopped on page {} with status {}", resource.path(), request.page(),
						response.statusCode());
				return PageResult.interrupted(items, response.statusCode());
			}
			List<JsonNode> page = parsePage(response);
			if (page.isEmpty()) {
				return PageResult.complete(items);
			}
			items.addAll(page);
			request = request.next();
		}
	}

	private List<JsonNode> parsePage(GitHubResponse response) {
		try {
			JsonNode node = objectMapper.readTree(response.body());
			return JsonNodeUtils.getArray(node);
		}
		catch (JsonProcessingException e) {
			logger.warn("Unparseable list page treated as end of data: {}", e.getOriginalMessage());
			return List.of();
		}
	}

	private List<JsonNode> parseStrictPage(ListResource resource, PageRequest request, GitHubResponse response) {
		JsonNode node;
		try {
			node = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			logger.error("Listing {} returned an unparseable page {}: {}", resource.path(), request.page(),
					e.getOriginalMessage());
			throw AuditException.upstreamFailure(response.statusCode(), "unparseable list page " + request.page()
					+ " of " + resource.path());
		}
		if (node == null || !node.isArray()) {
			logger.error("Listing {} returned a non-array page {}", resource.path(), request.page());
			throw AuditException.upstreamFailure(response.statusCode(),
					"list page " + request.page() + " of " + resource.path() + " is not an array");
		}
		return JsonNodeUtils.getArray(node);
	}

	private static AuditException toFailure(ListResource resource, GitHubResponse response) {
		if (response.statusCode() == 401) {
			return AuditException.invalidCredentials();
		}
		else if (response.statusCode() == 404) {
			return AuditException.organizationNotFound(resource.organization());
		}
		return AuditException.upstreamFailure(response.statusCode(), response.body());
	}

}
