package org.springaicommunity.github.auditor;

/**
 * Repository counts of an organization.
 */
public record OrganizationStats(int totalRepositories, int activeRepositories, int archivedRepositories,
		int privateRepositories, int publicRepositories) {
}
