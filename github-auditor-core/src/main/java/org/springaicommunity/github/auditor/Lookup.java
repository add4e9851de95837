package org.springaicommunity.github.auditor;

/**
 * Result of one per-unit sub-request, distinguishing a value GitHub actually returned
 * from a default used because the value does not exist or because the call failed.
 *
 * @param value the value, or the default when not {@link Status#PRESENT}
 * @param status how the value was obtained
 */
public record Lookup<T>(T value, Status status) {

	public enum Status {

		/** GitHub returned the value. */
		PRESENT,

		/** GitHub answered that there is nothing (e.g. 404 on a file, empty event list). */
		ABSENT,

		/** The call failed; the value is a placeholder. */
		DEGRADED

	}

	public static <T> Lookup<T> present(T value) {
		return new Lookup<>(value, Status.PRESENT);
	}

	public static <T> Lookup<T> absent(T defaultValue) {
		return new Lookup<>(defaultValue, Status.ABSENT);
	}

	public static <T> Lookup<T> degraded(T defaultValue) {
		return new Lookup<>(defaultValue, Status.DEGRADED);
	}

	public boolean isDegraded() {
		return status == Status.DEGRADED;
	}

}
