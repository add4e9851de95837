package org.springaicommunity.github.auditor;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The audits the engine can stream.
 */
public enum AuditKind {

	REPOS("repos", new EventVocabulary("total_repos", "repo", "repo_data")),

	BRANCHES("branches", new EventVocabulary("total_repos", "repo", "branches")),

	ACCESS("access", new EventVocabulary("total_repos", "repo", "access_data")),

	MEMBERS("members", new EventVocabulary("total_members", "member", "member_data")),

	TEAMS("teams", new EventVocabulary("total_teams", "team", "team_data"));

	private final String id;

	private final EventVocabulary vocabulary;

	AuditKind(String id, EventVocabulary vocabulary) {
		this.id = id;
		this.vocabulary = vocabulary;
	}

	public String id() {
		return id;
	}

	public EventVocabulary vocabulary() {
		return vocabulary;
	}

	/**
	 * Look up a kind by its id, e.g. {@code "branches"}.
	 * @throws IllegalArgumentException for unknown ids
	 */
	public static AuditKind fromId(String id) {
		String normalized = id.trim().toLowerCase(Locale.ROOT);
		for (AuditKind kind : values()) {
			if (kind.id.equals(normalized)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown audit type '" + id + "': must be one of " + ids());
	}

	public static String ids() {
		return Arrays.stream(values()).map(AuditKind::id).collect(Collectors.joining(", "));
	}

}
