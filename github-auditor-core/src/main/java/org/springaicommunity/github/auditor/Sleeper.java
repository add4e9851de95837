package org.springaicommunity.github.auditor;

import java.time.Duration;

/**
 * Suspends the calling thread. Replaced in tests to observe backoff waits without
 * actually sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
