package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent {@link WorkUnit}s concurrently under a {@link PermitPool} and exposes
 * their results in completion order.
 *
 * <p>
 * Mechanics:
 * <ul>
 * <li>A dispatcher thread acquires one permit per unit, in submission order, before
 * handing the unit to a worker. No unit starts before a permit is free.</li>
 * <li>A worker holds its permit for the unit's whole lifetime, including rate-limit
 * backoff sleeps, and releases it unconditionally when the unit ends.</li>
 * <li>A unit's exception is converted into its degraded result; sibling units and the
 * scheduler are unaffected.</li>
 * <li>Finished results go to a queue bounded by the permit capacity and a worker hands
 * its result over before releasing its permit, so a slow consumer slows the run down
 * instead of buffering without bound.</li>
 * </ul>
 */
public class FanOutScheduler {

	private static final Logger logger = LoggerFactory.getLogger(FanOutScheduler.class);

	private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

	/**
	 * Start running the units.
	 * @param units the units to run
	 * @param permits the concurrency ceiling shared by the units
	 * @return a lazy, completion-ordered stream with one outcome per unit; callers must
	 * close it
	 */
	public <R> CompletionStream<R> run(List<? extends WorkUnit<R>> units, PermitPool permits) {
		int run = RUN_SEQUENCE.incrementAndGet();
		ExecutorService dispatcher = Executors.newSingleThreadExecutor(threads("audit-" + run + "-dispatch"));
		ExecutorService unitExecutor = Executors.newCachedThreadPool(threads("audit-" + run + "-unit"));
		ExecutorService subRequestExecutor = Executors.newCachedThreadPool(threads("audit-" + run + "-request"));

		BlockingQueue<UnitOutcome<R>> completed = new ArrayBlockingQueue<>(permits.capacity());
		UnitContext context = new UnitContext(subRequestExecutor);
		List<? extends WorkUnit<R>> snapshot = List.copyOf(units);

		logger.debug("Run {}: scheduling {} units with {} permits", run, snapshot.size(), permits.capacity());
		CompletionStream<R> stream = new CompletionStream<>(snapshot.size(), completed,
				List.of(dispatcher, unitExecutor, subRequestExecutor));
		if (!snapshot.isEmpty()) {
			dispatcher.execute(() -> dispatch(snapshot, permits, unitExecutor, context, completed));
		}
		return stream;
	}

	private <R> void dispatch(List<? extends WorkUnit<R>> units, PermitPool permits, ExecutorService unitExecutor,
			UnitContext context, BlockingQueue<UnitOutcome<R>> completed) {
		int started = 0;
		for (WorkUnit<R> unit : units) {
			try {
				permits.acquire();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.debug("Dispatch cancelled, {} of {} units never started", units.size() - started,
						units.size());
				return;
			}
			try {
				unitExecutor.execute(() -> runUnit(unit, permits, context, completed));
				started++;
			}
			catch (RejectedExecutionException e) {
				permits.release();
				logger.debug("Dispatch stopped, {} of {} units never started", units.size() - started, units.size());
				return;
			}
		}
	}

	private <R> void runUnit(WorkUnit<R> unit, PermitPool permits, UnitContext context,
			BlockingQueue<UnitOutcome<R>> completed) {
		try {
			UnitOutcome<R> outcome = execute(unit, context);
			completed.put(outcome);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("Unit {} cancelled", unit.key());
		}
		finally {
			permits.release();
		}
	}

	private <R> UnitOutcome<R> execute(WorkUnit<R> unit, UnitContext context) throws InterruptedException {
		long start = System.currentTimeMillis();
		try {
			R result = unit.execute(context);
			logger.debug("Unit {} completed in {}ms", unit.key(), System.currentTimeMillis() - start);
			return UnitOutcome.completed(unit.key(), result);
		}
		catch (InterruptedException e) {
			throw e;
		}
		catch (Exception e) {
			logger.warn("Unit {} failed after {}ms, reporting degraded result: {}", unit.key(),
					System.currentTimeMillis() - start, e.getMessage());
			return UnitOutcome.degraded(unit.key(), degrade(unit, e), e);
		}
	}

	private static <R> @Nullable R degrade(WorkUnit<R> unit, Exception cause) {
		try {
			return unit.degrade(cause);
		}
		catch (RuntimeException e) {
			logger.error("Unit {} could not produce a degraded result", unit.key(), e);
			return null;
		}
	}

	private static ThreadFactory threads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
