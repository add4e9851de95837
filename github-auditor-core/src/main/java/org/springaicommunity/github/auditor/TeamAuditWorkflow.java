package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.List;

/**
 * Team overview audit. Counts come from the team listing; the team itself is only
 * fetched when the listing reports neither members nor repositories.
 */
public class TeamAuditWorkflow extends AbstractAuditWorkflow<JsonNode, TeamAudit> {

	public TeamAuditWorkflow(RestService restService, Clock clock) {
		super(restService, clock);
	}

	@Override
	public AuditKind kind() {
		return AuditKind.TEAMS;
	}

	@Override
	public List<JsonNode> loadEntities(String organization) {
		return restService.listOrganizationTeams(organization);
	}

	@Override
	public String identify(JsonNode team) {
		return JsonNodeUtils.getString(team, "name", "");
	}

	@Override
	public TeamAudit audit(UnitContext context, String organization, JsonNode team) {
		TeamCounts counts = new TeamCounts(JsonNodeUtils.getInt(team, "members_count", 0),
				JsonNodeUtils.getInt(team, "repos_count", 0));
		List<String> degraded = List.of();
		if (counts.isZero()) {
			Lookup<TeamCounts> fetched = restService.getTeamCounts(organization,
					JsonNodeUtils.getString(team, "slug", ""));
			counts = fetched.value();
			if (fetched.isDegraded()) {
				degraded = List.of("members_count", "repos_count");
			}
		}
		return build(team, counts, degraded);
	}

	@Override
	public TeamAudit degrade(String organization, JsonNode team, Exception cause) {
		return build(team, TeamCounts.ZERO, List.of("members_count", "repos_count"));
	}

	@Override
	public boolean hasData(TeamAudit result) {
		return true;
	}

	private TeamAudit build(JsonNode team, TeamCounts counts, List<String> degraded) {
		String description = JsonNodeUtils.getString(team, "description")
			.filter(d -> !d.isEmpty())
			.orElse("No description");
		return new TeamAudit(identify(team), description, JsonNodeUtils.getString(team, "privacy", "closed"),
				counts.membersCount(), counts.reposCount(), degraded);
	}

}
