package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

/**
 * A finished unit as delivered by a {@link CompletionStream}.
 *
 * @param key the unit's key
 * @param result the unit's result, or its degraded result; null only when even the
 * degraded result could not be produced
 * @param failure the exception that forced a degraded result, or null on success
 */
public record UnitOutcome<R>(String key, @Nullable R result, @Nullable Exception failure) {

	public static <R> UnitOutcome<R> completed(String key, R result) {
		return new UnitOutcome<>(key, result, null);
	}

	public static <R> UnitOutcome<R> degraded(String key, @Nullable R result, Exception failure) {
		return new UnitOutcome<>(key, result, failure);
	}

	public boolean isDegraded() {
		return failure != null;
	}

}
