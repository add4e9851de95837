package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

/**
 * A repository collaborator with their permissions.
 *
 * @param login the collaborator's GitHub username
 * @param permissions the collaborator's repository permissions, null when GitHub omitted
 * them
 */
public record Collaborator(String login, @Nullable Permissions permissions) {

	/**
	 * Highest access level granted: {@code admin}, {@code maintain}, {@code write} or
	 * {@code read}.
	 */
	public String accessLevel() {
		if (permissions == null) {
			return "read";
		}
		if (permissions.admin()) {
			return "admin";
		}
		if (permissions.maintain()) {
			return "maintain";
		}
		if (permissions.push()) {
			return "write";
		}
		return "read";
	}

	/**
	 * Repository permission levels for a collaborator.
	 *
	 * @param admin full repository access including settings
	 * @param maintain manage repository without sensitive settings access
	 * @param push read and write access (can push commits)
	 * @param triage read access plus manage issues and PRs
	 * @param pull read-only access
	 */
	public record Permissions(boolean admin, boolean maintain, boolean push, boolean triage, boolean pull) {
	}
}
