package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * GitHub REST API operations used by the audit workflows.
 *
 * <p>
 * Organization-level listings are fatal on failure ({@link AuditException}). Per-entity
 * lookups never fail on an HTTP status; they report defaults through {@link Lookup}.
 */
public interface RestService {

	// Organization listings (fatal)

	List<JsonNode> listOrganizationRepositories(String organization);

	List<JsonNode> listOrganizationMembers(String organization);

	List<JsonNode> listOrganizationTeams(String organization);

	// Per-repository lookups

	Lookup<Boolean> fileExists(String owner, String repo, String path);

	Lookup<BranchRules> getBranchRules(String owner, String repo, String branch);

	Lookup<List<String>> getAdminLogins(String owner, String repo);

	Lookup<Integer> countBranches(String owner, String repo);

	Lookup<List<JsonNode>> listBranches(String owner, String repo);

	Lookup<Optional<Instant>> getCommitDate(String owner, String repo, String sha);

	Lookup<List<Collaborator>> listCollaborators(String owner, String repo);

	// Per-member and per-team lookups

	Lookup<String> getMembershipRole(String organization, String username);

	Lookup<String> getPublicEmail(String username);

	Lookup<Optional<Instant>> getLatestEventTime(String username);

	Lookup<TeamCounts> getTeamCounts(String organization, String slug);

}
