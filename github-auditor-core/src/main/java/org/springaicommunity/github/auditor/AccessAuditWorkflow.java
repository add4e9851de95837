package org.springaicommunity.github.auditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collaborator access audit over the non-archived repositories.
 */
public class AccessAuditWorkflow extends AbstractAuditWorkflow<String, List<AccessRecord>> {

	private static final Logger logger = LoggerFactory.getLogger(AccessAuditWorkflow.class);

	public AccessAuditWorkflow(RestService restService, Clock clock) {
		super(restService, clock);
	}

	@Override
	public AuditKind kind() {
		return AuditKind.ACCESS;
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
	public List<AccessRecord> audit(UnitContext context, String organization, String repo) {
		Lookup<List<Collaborator>> collaborators = restService.listCollaborators(organization, repo);
		if (collaborators.isDegraded()) {
			logger.warn("Collaborator listing for {}/{} incomplete, reporting {} entries", organization, repo,
					collaborators.value().size());
		}
		return collaborators.value()
			.stream()
			.map(collaborator -> new AccessRecord(repo, collaborator.login(), collaborator.accessLevel()))
			.collect(Collectors.toList());
	}

	@Override
	public List<AccessRecord> degrade(String organization, String repo, Exception cause) {
		return List.of();
	}

	@Override
	public boolean hasData(List<AccessRecord> result) {
		return !result.isEmpty();
	}

}
