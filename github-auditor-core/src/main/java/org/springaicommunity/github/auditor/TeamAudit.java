package org.springaicommunity.github.auditor;

import java.util.List;

/**
 * Overview of one team.
 */
public record TeamAudit(String name, String description, String privacy, int membersCount, int reposCount,
		List<String> degradedFields) {
}
