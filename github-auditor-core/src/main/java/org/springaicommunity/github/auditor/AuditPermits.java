package org.springaicommunity.github.auditor;

import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link PermitPool} per audit kind. Concurrent runs of the same kind share a pool;
 * runs of different kinds never wait on each other.
 */
public class AuditPermits {

	private final Map<AuditKind, PermitPool> pools = new EnumMap<>(AuditKind.class);

	private AuditPermits(int ceiling) {
		for (AuditKind kind : AuditKind.values()) {
			pools.put(kind, new PermitPool(ceiling));
		}
	}

	/**
	 * Pools of the same capacity for every kind.
	 * @param ceiling maximum concurrently running units per kind
	 */
	public static AuditPermits withCeiling(int ceiling) {
		return new AuditPermits(ceiling);
	}

	public PermitPool forKind(AuditKind kind) {
		return pools.get(kind);
	}

}
