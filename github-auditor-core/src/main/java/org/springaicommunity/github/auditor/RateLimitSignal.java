package org.springaicommunity.github.auditor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Rate-limit rejection derived from a single response.
 *
 * <p>
 * GitHub rejects over-budget calls with {@code 403} and usually includes the epoch second
 * at which the window resets. The signal is consumed immediately to compute one wait.
 *
 * @param resetEpochSeconds reset time in epoch seconds, or -1 when the header was absent
 */
public record RateLimitSignal(long resetEpochSeconds) {

	/**
	 * Inspect a response for a rate-limit rejection.
	 * @param response the response to inspect
	 * @return the signal, or empty when the response is not a rate-limit rejection
	 */
	public static Optional<RateLimitSignal> from(GitHubResponse response) {
		if (response.statusCode() != 403) {
			return Optional.empty();
		}
		return Optional.of(new RateLimitSignal(response.hasResetTime() ? response.resetEpochSeconds() : -1));
	}

	public boolean hasResetTime() {
		return resetEpochSeconds > 0;
	}

	/**
	 * Compute how long to wait before the next attempt. With a reset time this is the
	 * time until reset, at least one second and at most {@code maxResetWait}. Without one
	 * the wait grows linearly with the attempt number and is not capped.
	 * @param attempt 1-based number of the attempt that was rejected
	 * @param now current time
	 * @param maxResetWait upper bound for reset-based waits
	 * @param fallbackStep per-attempt increment when no reset time is known
	 * @return the wait duration
	 */
	public Duration waitDuration(int attempt, Instant now, Duration maxResetWait, Duration fallbackStep) {
		if (hasResetTime()) {
			long waitSeconds = Math.max(resetEpochSeconds - now.getEpochSecond(), 1);
			waitSeconds = Math.min(waitSeconds, maxResetWait.toSeconds());
			return Duration.ofSeconds(waitSeconds);
		}
		return fallbackStep.multipliedBy(attempt);
	}

}
