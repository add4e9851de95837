package org.springaicommunity.github.auditor;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting permits bounding how many audit units execute at the same time.
 *
 * <p>
 * A pool is an ordinary object handed to {@link FanOutScheduler#run}; different audit
 * kinds get different pools (see {@link AuditPermits}) so one workflow never throttles an
 * unrelated one. The pool is fair: waiting units obtain permits in arrival order.
 *
 * <p>
 * {@link #inUse()} and {@link #peakInUse()} are kept for observability and tests.
 */
public class PermitPool {

	private final int capacity;

	private final Semaphore semaphore;

	private final AtomicInteger inUse = new AtomicInteger();

	private final AtomicInteger peakInUse = new AtomicInteger();

	public PermitPool(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Permit capacity must be positive (got: " + capacity + ")");
		}
		this.capacity = capacity;
		this.semaphore = new Semaphore(capacity, true);
	}

	/**
	 * Block until a permit is free.
	 * @throws InterruptedException if the waiting thread is interrupted, in which case no
	 * permit is held
	 */
	public void acquire() throws InterruptedException {
		semaphore.acquire();
		int now = inUse.incrementAndGet();
		peakInUse.accumulateAndGet(now, Math::max);
	}

	/**
	 * Return a permit obtained through {@link #acquire()}.
	 */
	public void release() {
		inUse.decrementAndGet();
		semaphore.release();
	}

	public int capacity() {
		return capacity;
	}

	public int inUse() {
		return inUse.get();
	}

	public int peakInUse() {
		return peakInUse.get();
	}

	public int available() {
		return semaphore.availablePermits();
	}

}
