package org.springaicommunity.github.auditor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.auditor.AuditPermits;
import org.springaicommunity.github.auditor.AuditProperties;
import org.springaicommunity.github.auditor.GitHubAuditor;
import org.springaicommunity.github.auditor.GitHubAuditorBuilder;

/**
 * Creates a {@link GitHubAuditor} per caller token. All auditors share the server's
 * permit pools.
 */
public class AuditorFactory {

	private final AuditProperties properties;

	private final AuditPermits permits;

	private final ObjectMapper objectMapper;

	public AuditorFactory(AuditProperties properties, AuditPermits permits, ObjectMapper objectMapper) {
		this.properties = properties;
		this.permits = permits;
		this.objectMapper = objectMapper;
	}

	public GitHubAuditor create(String token) {
		return GitHubAuditorBuilder.create()
			.token(token)
			.properties(properties)
			.objectMapper(objectMapper)
			.permits(permits)
			.build();
	}

}
