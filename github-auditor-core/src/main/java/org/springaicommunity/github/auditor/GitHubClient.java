package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Implementations return the response whatever its status code, so callers decide what a
 * 403, 404 or 5xx means for them. Only transport failures are raised, as
 * {@link GitHubHttpClient.GitHubApiException}. The abstraction enables testability and
 * decorator implementations such as {@link RetryingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/orgs/acme/repos") or full URL
	 * @return the response, never null
	 * @throws GitHubHttpClient.GitHubApiException if the request could not be sent
	 */
	default GitHubResponse get(String path) {
		return get(path, Map.of());
	}

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param query query parameters, encoded by the implementation
	 * @return the response, never null
	 * @throws GitHubHttpClient.GitHubApiException if the request could not be sent
	 */
	GitHubResponse get(String path, Map<String, String> query);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
