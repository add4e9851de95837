package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Repository security audit: one unit per organization repository.
 *
 * <p>
 * Each unit issues four independent lookups concurrently: CODEOWNERS presence, default
 * branch rules, admin collaborators and branch count. The CODEOWNERS lookup itself probes
 * every recognized location concurrently.
 */
public class RepositoryAuditWorkflow extends AbstractAuditWorkflow<JsonNode, RepositoryAudit> {

	static final List<String> CODEOWNERS_PATHS = List.of("CODEOWNERS", "docs/CODEOWNERS", ".github/CODEOWNERS");

	public RepositoryAuditWorkflow(RestService restService, Clock clock) {
		super(restService, clock);
	}

	@Override
	public AuditKind kind() {
		return AuditKind.REPOS;
	}

	@Override
	public List<JsonNode> loadEntities(String organization) {
		return restService.listOrganizationRepositories(organization);
	}

	@Override
	public String identify(JsonNode repo) {
		return JsonNodeUtils.getString(repo, "name", "");
	}

	@Override
	public RepositoryAudit audit(UnitContext context, String organization, JsonNode repo) throws Exception {
		String name = identify(repo);
		String branch = defaultBranch(repo);

		CompletableFuture<Lookup<Boolean>> codeowners = context.fork(() -> hasCodeowners(context, organization, name));
		CompletableFuture<Lookup<BranchRules>> rules = context
			.fork(() -> restService.getBranchRules(organization, name, branch));
		CompletableFuture<Lookup<List<String>>> admins = context
			.fork(() -> restService.getAdminLogins(organization, name));
		CompletableFuture<Lookup<Integer>> branches = context.fork(() -> restService.countBranches(organization, name));
		context.awaitAll(codeowners, rules, admins, branches);

		Lookup<Boolean> codeownersLookup = context.join(codeowners);
		Lookup<BranchRules> rulesLookup = context.join(rules);
		Lookup<List<String>> adminsLookup = context.join(admins);
		Lookup<Integer> branchesLookup = context.join(branches);

		Map<String, Lookup<?>> fields = fields();
		fields.put("has_codeowners", codeownersLookup);
		fields.put("branch_rules", rulesLookup);
		fields.put("admins", adminsLookup);
		fields.put("branch_count", branchesLookup);

		return build(organization, repo, codeownersLookup.value(), rulesLookup.value(), adminsLookup.value(),
				branchesLookup.value(), degradedFields(fields));
	}

	@Override
	public RepositoryAudit degrade(String organization, JsonNode repo, Exception cause) {
		return build(organization, repo, false, BranchRules.NONE, List.of(), 0,
				List.of("has_codeowners", "branch_rules", "admins", "branch_count"));
	}

	@Override
	public boolean hasData(RepositoryAudit result) {
		return true;
	}

	private Lookup<Boolean> hasCodeowners(UnitContext context, String organization, String repo) throws Exception {
		List<CompletableFuture<Lookup<Boolean>>> probes = CODEOWNERS_PATHS.stream()
			.map(path -> context.fork(() -> restService.fileExists(organization, repo, path)))
			.toList();
		context.awaitAll(probes.toArray(new CompletableFuture<?>[0]));

		boolean degraded = false;
		for (CompletableFuture<Lookup<Boolean>> probe : probes) {
			Lookup<Boolean> found = context.join(probe);
			if (Boolean.TRUE.equals(found.value())) {
				return Lookup.present(true);
			}
			degraded |= found.isDegraded();
		}
		return degraded ? Lookup.degraded(false) : Lookup.absent(false);
	}

	private static String defaultBranch(JsonNode repo) {
		return JsonNodeUtils.getString(repo, "default_branch", "main");
	}

	private static RepositoryAudit build(String organization, JsonNode repo, boolean hasCodeowners, BranchRules rules,
			List<String> admins, int branchCount, List<String> degradedFields) {
		return new RepositoryAudit(JsonNodeUtils.getString(repo, "name", ""), organization,
				JsonNodeUtils.getNullableString(repo, "description"), joinTopics(repo),
				JsonNodeUtils.getBoolean(repo, "private", false), JsonNodeUtils.getBoolean(repo, "archived", false),
				defaultBranch(repo), JsonNodeUtils.getNullableString(repo, "language"),
				JsonNodeUtils.getInt(repo, "stargazers_count", 0), JsonNodeUtils.getInt(repo, "forks_count", 0),
				admins.size(), String.join(", ", admins), hasCodeowners, rules.hasRequiredReviewers(),
				rules.allowsDirectPush(), JsonNodeUtils.getString(repo, "html_url", ""), branchCount, degradedFields);
	}

}
