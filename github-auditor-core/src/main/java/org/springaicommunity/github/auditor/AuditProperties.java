package org.springaicommunity.github.auditor;

import java.time.Duration;

/**
 * Configuration properties for organization audits.
 *
 * <p>
 * Properties can be set directly via setters, passed to {@link GitHubAuditorBuilder}, or
 * bound from {@code auditor.*} in the server's {@code application.yml}. Default values
 * match GitHub's documented limits and are suitable for most organizations.
 */
public class AuditProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = GitHubHttpClient.GITHUB_API_BASE;

	/**
	 * Maximum number of audit units running at once, per audit kind.
	 */
	private int concurrency = 5;

	/**
	 * Items requested per page from GitHub list endpoints (at most 100).
	 */
	private int pageSize = PageCollector.DEFAULT_PAGE_SIZE;

	/**
	 * Number of rate-limited responses waited out before the final attempt.
	 */
	private int maxRetries = 3;

	/**
	 * Upper bound for a wait computed from the rate-limit reset time.
	 */
	private Duration maxResetWait = Duration.ofSeconds(120);

	/**
	 * Per-attempt wait when a rate-limited response carries no reset time.
	 */
	private Duration fallbackStep = Duration.ofSeconds(30);

	/**
	 * Days of inactivity reported for members without recent public events.
	 */
	private long inactiveDaysDefault = 91;


	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	/**
	 * Returns the maximum number of concurrently running audit units.
	 * @return the concurrency ceiling
	 */
	public int getConcurrency() {
		return concurrency;
	}

	/**
	 * Sets the maximum number of concurrently running audit units.
	 * @param concurrency the concurrency ceiling, at least 1
	 */
	public void setConcurrency(int concurrency) {
		this.concurrency = concurrency;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	/**
	 * Returns how many rate-limited responses are retried.
	 * @return the maximum retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Sets how many rate-limited responses are retried before the final attempt.
	 * @param maxRetries the maximum retries
	 */
	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getMaxResetWait() {
		return maxResetWait;
	}

	public void setMaxResetWait(Duration maxResetWait) {
		this.maxResetWait = maxResetWait;
	}

	public Duration getFallbackStep() {
		return fallbackStep;
	}

	public void setFallbackStep(Duration fallbackStep) {
		this.fallbackStep = fallbackStep;
	}

	public long getInactiveDaysDefault() {
		return inactiveDaysDefault;
	}

	public void setInactiveDaysDefault(long inactiveDaysDefault) {
		this.inactiveDaysDefault = inactiveDaysDefault;
	}

}
