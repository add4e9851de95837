package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * A notification pushed to the consumer of an audit stream.
 *
 * <p>
 * A successful run produces {@code start}, then {@code progress} (and, for units with
 * data, {@code data}) per finished unit, then {@code done}. A run whose entity list
 * cannot be loaded produces a single {@code error}.
 *
 * @param type the event type
 * @param total number of units, for {@code start}
 * @param subject identifier of the finished unit, for {@code progress}
 * @param processed cumulative number of finished units, for {@code progress}
 * @param payload the unit's result, for {@code data}
 * @param detail failure description, for {@code error}
 */
public record AuditEvent(Type type, int total, @Nullable String subject, int processed, @Nullable Object payload,
		@Nullable String detail) {

	public enum Type {

		START, PROGRESS, DATA, ERROR, DONE;

		public String wireName() {
			return name().toLowerCase(Locale.ROOT);
		}

	}

	public static AuditEvent start(int total) {
		return new AuditEvent(Type.START, total, null, 0, null, null);
	}

	public static AuditEvent progress(String subject, int processed) {
		return new AuditEvent(Type.PROGRESS, 0, subject, processed, null, null);
	}

	public static AuditEvent data(Object payload) {
		return new AuditEvent(Type.DATA, 0, null, 0, payload, null);
	}

	public static AuditEvent error(String detail) {
		return new AuditEvent(Type.ERROR, 0, null, 0, null, detail);
	}

	public static AuditEvent done() {
		return new AuditEvent(Type.DONE, 0, null, 0, null, null);
	}

}
