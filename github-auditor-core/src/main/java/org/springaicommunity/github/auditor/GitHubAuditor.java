package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Clock;

/**
 * Entry point for streaming organization audits. Created by
 * {@link GitHubAuditorBuilder}; safe to share between concurrent runs.
 */
public class GitHubAuditor {

	private final RestService restService;

	private final GitHubClient client;

	private final AuditEventEmitter emitter;

	private final AuditPermits permits;

	private final Clock clock;

	private final long inactiveDaysDefault;

	GitHubAuditor(RestService restService, GitHubClient client, AuditEventEmitter emitter, AuditPermits permits,
			Clock clock, long inactiveDaysDefault) {
		this.restService = restService;
		this.client = client;
		this.emitter = emitter;
		this.permits = permits;
		this.clock = clock;
		this.inactiveDaysDefault = inactiveDaysDefault;
	}

	/**
	 * Run one audit, sending its events to the sink as units finish.
	 * @param kind which audit to run
	 * @param organization the organization login
	 * @param sink destination of the events
	 * @return summary of the run
	 * @throws IOException if the sink failed; the run has been cancelled
	 */
	public AuditSummary stream(AuditKind kind, String organization, EventSink sink) throws IOException {
		return emitter.emit(organization, workflow(kind), permits.forKind(kind), sink);
	}

	/**
	 * Repository counts of the organization.
	 * @throws AuditException when the repository list cannot be read
	 */
	public OrganizationStats basicStats(String organization) {
		return new OrganizationStatsService(restService).basicStats(organization);
	}

	public AuditWorkflow<?, ?> workflow(AuditKind kind) {
		switch (kind) {
			case REPOS:
				return new RepositoryAuditWorkflow(restService, clock);
			case BRANCHES:
				return new BranchAuditWorkflow(restService, clock);
			case ACCESS:
				return new AccessAuditWorkflow(restService, clock);
			case MEMBERS:
				return new MemberAuditWorkflow(restService, clock, inactiveDaysDefault);
			case TEAMS:
				return new TeamAuditWorkflow(restService, clock);
			default:
				throw new IllegalArgumentException("Unsupported audit kind: " + kind);
		}
	}

	public PermitPool permits(AuditKind kind) {
		return permits.forKind(kind);
	}

	/**
	 * Rate limit reported by the most recent GitHub response, if any.
	 */
	public @Nullable RateLimitInfo lastRateLimitInfo() {
		return client.getLastRateLimitInfo();
	}

}
