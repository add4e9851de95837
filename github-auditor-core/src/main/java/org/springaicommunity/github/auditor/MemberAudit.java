package org.springaicommunity.github.auditor;

import java.util.List;

/**
 * Role and activity of one organization member.
 *
 * @param username member login
 * @param role organization role ({@code admin} or {@code member})
 * @param email public email, {@code N/A} when unknown
 * @param lastActivity date of the latest public event as yyyy-MM-dd, or
 * {@code No recent activity}
 * @param daysInactive days since the latest public event
 * @param degradedFields fields holding placeholder values because a lookup failed
 */
public record MemberAudit(String username, String role, String email, String lastActivity, long daysInactive,
		List<String> degradedFields) {
}
