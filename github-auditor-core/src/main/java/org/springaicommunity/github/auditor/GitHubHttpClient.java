package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP client for GitHub REST API calls using the Java 11+ HttpClient.
 *
 * <p>
 * One instance is shared by every concurrently running audit unit; the underlying
 * {@link HttpClient} is thread-safe and nothing else here is mutated except the last
 * observed {@link RateLimitInfo}.
 *
 * <p>
 * Unlike a typical REST client this class does not turn error statuses into exceptions.
 * Rate-limit handling lives in {@link RetryingGitHubClient} and status interpretation in
 * the callers.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String GITHUB_API_BASE = "https://api.github.com";

	static final String API_VERSION = "2022-11-28";

	private final HttpClient httpClient;

	private final String token;

	private final String baseUrl;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_API_BASE);
	}

	public GitHubHttpClient(String token, String baseUrl) {
		this.token = token;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public GitHubResponse get(String path, Map<String, String> query) {
		String url = buildUrl(path, query);
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", API_VERSION)
			.header("User-Agent", "github-auditor")
			.GET()
			.build();

		try {
			GitHubResponse response = executeRequest(request);
			logger.debug("GET {} -> {} in {}ms ({} bytes)", url, response.statusCode(),
					System.currentTimeMillis() - start, response.body().length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("GET {} failed after {}ms: {}", url, System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	String buildUrl(String path, Map<String, String> query) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		if (query.isEmpty()) {
			return url;
		}
		String queryString = query.entrySet()
			.stream()
			.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
			.collect(Collectors.joining("&"));
		return url + (url.contains("?") ? "&" : "?") + queryString;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private GitHubResponse executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Extract rate limit headers from ALL responses (2xx included)
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
				if (this.lastRateLimitInfo.isLow()) {
					logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
				else {
					logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
				}
			}

			String body = response.body() != null ? response.body() : "";
			return new GitHubResponse(response.statusCode(), body, remaining, reset);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub API call could not be completed at the transport
	 * level (connection failure, interruption). HTTP error statuses are not reported
	 * through this exception.
	 */
	public static class GitHubApiException extends RuntimeException {

		public GitHubApiException(String message) {
			super(message);
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
		}

	}

}
