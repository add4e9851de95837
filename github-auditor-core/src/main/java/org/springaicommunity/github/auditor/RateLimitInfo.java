package org.springaicommunity.github.auditor;

import java.time.Instant;

/**
 * Quota reported by the {@code X-RateLimit-*} headers of the latest GitHub response.
 *
 * @param limit requests allowed per window
 * @param remaining requests left in the current window
 * @param reset end of the window, epoch seconds
 * @param used requests spent in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Remaining quota below which the client logs at info level.
	 */
	public static final int LOW_REMAINING = 100;

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isLow() {
		return remaining < LOW_REMAINING;
	}

}
