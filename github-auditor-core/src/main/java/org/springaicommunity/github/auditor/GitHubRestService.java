package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to audit DTOs at the service boundary. All calls go
 * through the injected {@link GitHubClient}, normally a {@link RetryingGitHubClient}, so
 * rate-limited calls are already retried by the time a status is inspected here.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	private final GitHubClient httpClient;

	private final PageCollector pageCollector;

	private final ObjectMapper objectMapper;

	public GitHubRestService(GitHubClient httpClient, PageCollector pageCollector, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.pageCollector = pageCollector;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<JsonNode> listOrganizationRepositories(String organization) {
		return pageCollector.collectAll(ListResource.of(organization, "/orgs/" + organization + "/repos"));
	}

	@Override
	public List<JsonNode> listOrganizationMembers(String organization) {
		return pageCollector.collectAll(ListResource.of(organization, "/orgs/" + organization + "/members"));
	}

	@Override
	public List<JsonNode> listOrganizationTeams(String organization) {
		return pageCollector.collectAll(ListResource.of(organization, "/orgs/" + organization + "/teams"));
	}

	@Override
	public Lookup<Boolean> fileExists(String owner, String repo, String path) {
		GitHubResponse response = httpClient.get(repoPath(owner, repo) + "/contents/" + path);
		if (response.isOk()) {
			return Lookup.present(true);
		}
		if (response.statusCode() == 404) {
			return Lookup.absent(false);
		}
		logger.debug("Content lookup {}/{}:{} failed with status {}", owner, repo, path, response.statusCode());
		return Lookup.degraded(false);
	}

	@Override
	public Lookup<BranchRules> getBranchRules(String owner, String repo, String branch) {
		GitHubResponse response = httpClient.get(repoPath(owner, repo) + "/rules/branches/" + branch);
		if (response.statusCode() == 404) {
			return Lookup.absent(BranchRules.NONE);
		}
		JsonNode rules = response.isOk() ? parse(response) : null;
		if (rules == null) {
			logger.debug("Branch rules {}/{}@{} unavailable (status {})", owner, repo, branch, response.statusCode());
			return Lookup.degraded(BranchRules.NONE);
		}

		boolean allowsDirectPush = true;
		boolean hasRequiredReviewers = false;
		for (JsonNode rule : JsonNodeUtils.getArray(rules)) {
			if ("pull_request".equals(JsonNodeUtils.getString(rule, "type", ""))) {
				allowsDirectPush = false;
				if (JsonNodeUtils.getInt(rule.path("parameters"), "required_approving_review_count", 0) > 0) {
					hasRequiredReviewers = true;
				}
			}
		}
		return Lookup.present(new BranchRules(allowsDirectPush, hasRequiredReviewers));
	}

	@Override
	public Lookup<List<String>> getAdminLogins(String owner, String repo) {
		ListResource admins = ListResource.of(owner, repoPath(owner, repo) + "/collaborators")
			.withQuery("permission", "admin");
		PageResult result = pageCollector.collectAvailable(admins);
		if (!result.complete()) {
			logger.debug("Admin listing {}/{} failed with status {}", owner, repo, result.failedStatus());
			return Lookup.degraded(List.of());
		}
		List<String> logins = new ArrayList<>();
		for (JsonNode user : result.items()) {
			logins.add(JsonNodeUtils.getString(user, "login", ""));
		}
		return Lookup.present(logins);
	}

	@Override
	public Lookup<Integer> countBranches(String owner, String repo) {
		PageResult result = pageCollector.collectAvailable(branchesOf(owner, repo));
		int count = result.items().size();
		return result.complete() ? Lookup.present(count) : Lookup.degraded(count);
	}

	@Override
	public Lookup<List<JsonNode>> listBranches(String owner, String repo) {
		PageResult result = pageCollector.collectAvailable(branchesOf(owner, repo));
		return result.complete() ? Lookup.present(result.items()) : Lookup.degraded(result.items());
	}

	@Override
	public Lookup<Optional<Instant>> getCommitDate(String owner, String repo, String sha) {
		GitHubResponse response = httpClient.get(repoPath(owner, repo) + "/commits/" + sha);
		JsonNode commit = response.isOk() ? parse(response) : null;
		if (commit == null) {
			return Lookup.degraded(Optional.empty());
		}
		Optional<Instant> date = JsonNodeUtils.getInstant(commit, "commit", "committer", "date");
		return date.isPresent() ? Lookup.present(date) : Lookup.absent(date);
	}

	@Override
	public Lookup<List<Collaborator>> listCollaborators(String owner, String repo) {
		PageResult result = pageCollector
			.collectAvailable(ListResource.of(owner, repoPath(owner, repo) + "/collaborators"));
		List<Collaborator> collaborators = new ArrayList<>();
		for (JsonNode node : result.items()) {
			collaborators.add(parseCollaborator(node));
		}
		if (!result.complete()) {
			logger.debug("Collaborator listing {}/{} stopped with status {} after {} entries", owner, repo,
					result.failedStatus(), collaborators.size());
			return Lookup.degraded(collaborators);
		}
		return Lookup.present(collaborators);
	}

	@Override
	public Lookup<String> getMembershipRole(String organization, String username) {
		GitHubResponse response = httpClient.get("/orgs/" + organization + "/memberships/" + username);
		JsonNode membership = response.isOk() ? parse(response) : null;
		if (membership == null) {
			return Lookup.degraded("member");
		}
		return Lookup.present(JsonNodeUtils.getString(membership, "role", "member"));
	}

	@Override
	public Lookup<String> getPublicEmail(String username) {
		GitHubResponse response = httpClient.get("/users/" + username);
		JsonNode profile = response.isOk() ? parse(response) : null;
		if (profile == null) {
			return Lookup.degraded("N/A");
		}
		Optional<String> email = JsonNodeUtils.getString(profile, "email").filter(e -> !e.isEmpty());
		return email.map(Lookup::present).orElseGet(() -> Lookup.absent("N/A"));
	}

	@Override
	public Lookup<Optional<Instant>> getLatestEventTime(String username) {
		GitHubResponse response = httpClient.get("/users/" + username + "/events", Map.of("per_page", "1"));
		JsonNode events = response.isOk() ? parse(response) : null;
		if (events == null) {
			return Lookup.degraded(Optional.empty());
		}
		List<JsonNode> latest = JsonNodeUtils.getArray(events);
		if (latest.isEmpty()) {
			return Lookup.absent(Optional.empty());
		}
		Optional<Instant> created = JsonNodeUtils.getInstant(latest.get(0), "created_at");
		return created.isPresent() ? Lookup.present(created) : Lookup.absent(created);
	}

	@Override
	public Lookup<TeamCounts> getTeamCounts(String organization, String slug) {
		GitHubResponse response = httpClient.get("/orgs/" + organization + "/teams/" + slug);
		JsonNode team = response.isOk() ? parse(response) : null;
		if (team == null) {
			return Lookup.degraded(TeamCounts.ZERO);
		}
		return Lookup.present(new TeamCounts(JsonNodeUtils.getInt(team, "members_count", 0),
				JsonNodeUtils.getInt(team, "repos_count", 0)));
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + owner + "/" + repo;
	}

	private static ListResource branchesOf(String owner, String repo) {
		return ListResource.of(owner, repoPath(owner, repo) + "/branches");
	}

	private static Collaborator parseCollaborator(JsonNode node) {
		JsonNode perms = node.path("permissions");
		Collaborator.Permissions permissions = null;
		if (perms.isObject()) {
			permissions = new Collaborator.Permissions(JsonNodeUtils.getBoolean(perms, "admin", false),
					JsonNodeUtils.getBoolean(perms, "maintain", false), JsonNodeUtils.getBoolean(perms, "push", false),
					JsonNodeUtils.getBoolean(perms, "triage", false), JsonNodeUtils.getBoolean(perms, "pull", false));
		}
		return new Collaborator(JsonNodeUtils.getString(node, "login", ""), permissions);
	}

	private @Nullable JsonNode parse(GitHubResponse response) {
		try {
			return objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to parse GitHub response: {}", e.getOriginalMessage());
			return null;
		}
	}

}
