package org.springaicommunity.github.auditor;

/**
 * Member and repository counts of a team.
 */
public record TeamCounts(int membersCount, int reposCount) {

	public static final TeamCounts ZERO = new TeamCounts(0, 0);

	public boolean isZero() {
		return membersCount == 0 && reposCount == 0;
	}

}
