package org.springaicommunity.github.auditor;

import java.util.function.Function;

/**
 * One independently schedulable piece of fan-out work, mapped to one audited entity.
 *
 * @param <R> the unit's result type
 */
public interface WorkUnit<R> {

	/**
	 * Identifier reported with the unit's progress, e.g. a repository name.
	 */
	String key();

	/**
	 * Run the unit. Sub-requests that do not depend on each other should be started with
	 * {@link UnitContext#fork} so they proceed concurrently.
	 * @param context per-run context giving access to the sub-request pool
	 * @return the unit's result
	 * @throws Exception any failure; the scheduler converts it via {@link #degrade}
	 */
	R execute(UnitContext context) throws Exception;

	/**
	 * Result to report when {@link #execute} failed.
	 * @param cause the failure
	 * @return a result populated with default values
	 */
	R degrade(Exception cause);

	static <R> WorkUnit<R> of(String key, Task<R> task, Function<Exception, R> fallback) {
		return new WorkUnit<>() {

			@Override
			public String key() {
				return key;
			}

			@Override
			public R execute(UnitContext context) throws Exception {
				return task.execute(context);
			}

			@Override
			public R degrade(Exception cause) {
				return fallback.apply(cause);
			}

		};
	}

	/**
	 * The body of a unit.
	 */
	@FunctionalInterface
	interface Task<R> {

		R execute(UnitContext context) throws Exception;

	}

}
