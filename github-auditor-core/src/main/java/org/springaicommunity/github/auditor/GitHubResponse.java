package org.springaicommunity.github.auditor;

/**
 * A GitHub REST API response as seen by the auditor.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, empty when there is none
 * @param rateLimitRemaining value of {@code X-RateLimit-Remaining}, or -1 when absent
 * @param resetEpochSeconds value of {@code X-RateLimit-Reset}, or -1 when absent
 */
public record GitHubResponse(int statusCode, String body, int rateLimitRemaining, long resetEpochSeconds) {

	public GitHubResponse(int statusCode, String body) {
		this(statusCode, body, -1, -1);
	}

	public boolean isOk() {
		return statusCode == 200;
	}

	public boolean hasResetTime() {
		return resetEpochSeconds > 0;
	}

}
