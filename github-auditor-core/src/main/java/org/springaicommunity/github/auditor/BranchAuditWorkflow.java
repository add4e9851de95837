package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Branch age audit over the non-archived repositories. Each unit lists the repository's
 * branches and looks up the head commit of each branch in turn.
 */
public class BranchAuditWorkflow extends AbstractAuditWorkflow<String, List<BranchRecord>> {

	private static final Logger logger = LoggerFactory.getLogger(BranchAuditWorkflow.class);

	public BranchAuditWorkflow(RestService restService, Clock clock) {
		super(restService, clock);
	}

	@Override
	public AuditKind kind() {
		return AuditKind.BRANCHES;
	}

	@Override
	public List<String> loadEntities(String organization) {
		return activeRepositoryNames(organization);
	}

	@Override
	public String identify(String repo) {
		return repo;
	}

	@Override
	public List<BranchRecord> audit(UnitContext context, String organization, String repo) {
		Lookup<List<JsonNode>> branches = restService.listBranches(organization, repo);
		if (branches.isDegraded()) {
			logger.warn("Branch listing for {}/{} incomplete, reporting {} branches", organization, repo,
					branches.value().size());
		}

		List<BranchRecord> records = new ArrayList<>();
		for (JsonNode branch : branches.value()) {
			String name = JsonNodeUtils.getString(branch, "name", "");
			boolean isProtected = JsonNodeUtils.getBoolean(branch, "protected", false);
			Optional<String> sha = JsonNodeUtils.getString(branch.path("commit"), "sha");
			if (sha.isEmpty()) {
				records.add(new BranchRecord(repo, name, null, null, isProtected, List.of()));
				continue;
			}

			Lookup<Optional<Instant>> commitDate = restService.getCommitDate(organization, repo, sha.get());
			List<String> degraded = commitDate.isDegraded() ? List.of("last_commit_date", "age_days") : List.of();
			Optional<Instant> date = commitDate.value();
			records.add(new BranchRecord(repo, name, date.map(AbstractAuditWorkflow::formatDay).orElse(null),
					date.map(this::daysSince).orElse(null), isProtected, degraded));
		}
		return records;
	}

	@Override
	public List<BranchRecord> degrade(String organization, String repo, Exception cause) {
		return List.of();
	}

	@Override
	public boolean hasData(List<BranchRecord> result) {
		return !result.isEmpty();
	}

}
