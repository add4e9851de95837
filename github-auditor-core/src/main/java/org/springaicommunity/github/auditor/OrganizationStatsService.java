package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Repository counts of an organization, computed from a single repository listing.
 */
public class OrganizationStatsService {

	private static final Logger logger = LoggerFactory.getLogger(OrganizationStatsService.class);

	private final RestService restService;

	public OrganizationStatsService(RestService restService) {
		this.restService = restService;
	}

	/**
	 * Count the organization's repositories.
	 * @throws AuditException when the repository list cannot be read
	 */
	public OrganizationStats basicStats(String organization) {
		List<JsonNode> repos = restService.listOrganizationRepositories(organization);
		int archived = 0;
		int privateCount = 0;
		for (JsonNode repo : repos) {
			if (JsonNodeUtils.getBoolean(repo, "archived", false)) {
				archived++;
			}
			if (JsonNodeUtils.getBoolean(repo, "private", false)) {
				privateCount++;
			}
		}
		OrganizationStats stats = new OrganizationStats(repos.size(), repos.size() - archived, archived, privateCount,
				repos.size() - privateCount);
		logger.info("Organization {}: {} repositories ({} archived, {} private)", organization, repos.size(), archived,
				privateCount);
		return stats;
	}

}
