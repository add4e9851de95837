package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one streamed audit run.
 *
 * @param total number of units scheduled
 * @param processed number of units reported with a {@code progress} event
 * @param dataEvents number of {@code data} events sent
 * @param degraded number of units whose result was degraded by a failure
 * @param error detail sent in the {@code error} event, or null when the run started
 */
public record AuditSummary(int total, int processed, int dataEvents, int degraded, @Nullable String error) {

	public static AuditSummary failed(String error) {
		return new AuditSummary(0, 0, 0, 0, error);
	}

	public boolean succeeded() {
		return error == null;
	}

}
