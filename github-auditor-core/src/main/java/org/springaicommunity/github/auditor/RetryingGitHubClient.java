package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Decorator that retries rate-limited requests on a {@link GitHubClient}.
 *
 * <p>
 * Behavior:
 * <ul>
 * <li>Only {@code 403} responses are retried. Every other status, success or failure, is
 * returned immediately.</li>
 * <li>Reset-aware backoff: when {@code X-RateLimit-Reset} is present, waits until the
 * reset (at least 1 second, at most {@code maxResetWait}).</li>
 * <li>Without a reset header, waits {@code fallbackStep * attempt} (30s, 60s, 90s with
 * defaults).</li>
 * <li>Once the retry budget is spent one last request is issued and its response is
 * returned as-is; this client never raises for an HTTP status.</li>
 * </ul>
 *
 * <p>
 * The wait happens on the calling thread, so only the audit unit that issued the request
 * is suspended.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(token))
 *     .maxRetries(3)
 *     .maxResetWait(Duration.ofSeconds(120))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private final GitHubClient delegate;

	private final int maxRetries;

	private final Duration maxResetWait;

	private final Duration fallbackStep;

	private final Clock clock;

	private final Sleeper sleeper;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.maxResetWait = builder.maxResetWait;
		this.fallbackStep = builder.fallbackStep;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	/**
	 * Create a new builder for RetryingGitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public GitHubResponse get(String path, Map<String, String> query) {
		String description = "GET " + path + (query.isEmpty() ? "" : " " + query);

		for (int attempt = 1; attempt <= maxRetries; attempt++) {
			GitHubResponse response = delegate.get(path, query);
			Optional<RateLimitSignal> signal = RateLimitSignal.from(response);
			if (signal.isEmpty()) {
				return response;
			}

			Duration wait = signal.get().waitDuration(attempt, clock.instant(), maxResetWait, fallbackStep);
			if (signal.get().hasResetTime()) {
				logger.warn("{} rate limited (attempt {}/{}). Waiting {}s until reset at epoch {}", description,
						attempt, maxRetries, wait.toSeconds(), signal.get().resetEpochSeconds());
			}
			else {
				logger.warn("{} rate limited (attempt {}/{}) without reset header. Waiting {}s", description, attempt,
						maxRetries, wait.toSeconds());
			}
			sleep(wait);
		}

		// Budget spent: whatever comes back is the caller's to interpret
		GitHubResponse last = delegate.get(path, query);
		if (RateLimitSignal.from(last).isPresent()) {
			logger.error("{} still rate limited after {} retries, returning status {}", description, maxRetries,
					last.statusCode());
		}
		return last;
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Rate limit backoff interrupted", e);
		}
	}

	/**
	 * Builder for {@link RetryingGitHubClient}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxRetries: 3</li>
	 * <li>maxResetWait: 120 seconds</li>
	 * <li>fallbackStep: 30 seconds</li>
	 * </ul>
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private Duration maxResetWait = Duration.ofSeconds(120);

		private Duration fallbackStep = Duration.ofSeconds(30);

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.THREAD;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set how many rate-limited responses are waited out before the final attempt.
		 * @param maxRetries maximum retries (default: 3)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the upper bound for a wait computed from {@code X-RateLimit-Reset}.
		 * @param maxResetWait maximum wait (default: 120 seconds)
		 * @return this builder
		 */
		public Builder maxResetWait(Duration maxResetWait) {
			this.maxResetWait = maxResetWait;
			return this;
		}

		/**
		 * Set the per-attempt wait used when no reset header is present.
		 * @param fallbackStep wait increment (default: 30 seconds)
		 * @return this builder
		 */
		public Builder fallbackStep(Duration fallbackStep) {
			this.fallbackStep = fallbackStep;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (maxResetWait.isNegative() || maxResetWait.isZero()) {
				throw new IllegalStateException("maxResetWait must be positive");
			}
			if (fallbackStep.isNegative()) {
				throw new IllegalStateException("fallbackStep must not be negative");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
