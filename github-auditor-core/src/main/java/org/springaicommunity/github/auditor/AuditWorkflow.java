package org.springaicommunity.github.auditor;

import java.util.List;

/**
 * Domain logic plugged into the streaming engine: which entities an audit covers and
 * what is fetched for each of them.
 *
 * @param <E> the audited entity, e.g. a repository's JSON
 * @param <R> the per-entity result record
 */
public interface AuditWorkflow<E, R> {

	AuditKind kind();

	/**
	 * Load every entity of the organization. Runs to completion before any unit starts,
	 * since the {@code start} event carries the total.
	 * @throws AuditException when the list cannot be read; the run then ends with a
	 * single {@code error} event
	 */
	List<E> loadEntities(String organization);

	/**
	 * Identifier reported in {@code progress} events.
	 */
	String identify(E entity);

	/**
	 * Audit one entity. Runs inside a scheduler unit while holding a permit.
	 */
	R audit(UnitContext context, String organization, E entity) throws Exception;

	/**
	 * Result reported when {@link #audit} failed.
	 */
	R degrade(String organization, E entity, Exception cause);

	/**
	 * Whether the result is worth a {@code data} event.
	 */
	boolean hasData(R result);

}
