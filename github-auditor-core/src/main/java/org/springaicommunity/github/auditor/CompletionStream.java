package org.springaicommunity.github.auditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Results of one {@link FanOutScheduler} run, in the order units finished.
 *
 * <p>
 * The stream is lazy: {@link #next()} blocks until another unit has finished. It yields
 * exactly one {@link UnitOutcome} per submitted unit. Closing the stream before it is
 * exhausted cancels the run: units not yet started never start and running units are
 * interrupted.
 */
public final class CompletionStream<R> implements Iterator<UnitOutcome<R>>, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(CompletionStream.class);

	private final int total;

	private final BlockingQueue<UnitOutcome<R>> completed;

	private final List<ExecutorService> executors;

	private final AtomicInteger delivered = new AtomicInteger();

	private final AtomicBoolean closed = new AtomicBoolean();

	CompletionStream(int total, BlockingQueue<UnitOutcome<R>> completed, List<ExecutorService> executors) {
		this.total = total;
		this.completed = completed;
		this.executors = executors;
		if (total == 0) {
			shutdown();
		}
	}

	@Override
	public boolean hasNext() {
		return !closed.get() && delivered.get() < total;
	}

	/**
	 * Wait for the next unit to finish.
	 * @throws NoSuchElementException if every unit was already delivered or the stream is
	 * closed
	 * @throws CancellationException if the waiting thread is interrupted; the run is
	 * cancelled
	 */
	@Override
	public UnitOutcome<R> next() {
		if (!hasNext()) {
			throw new NoSuchElementException("All " + total + " units delivered");
		}
		try {
			UnitOutcome<R> outcome = completed.take();
			if (delivered.incrementAndGet() == total) {
				shutdown();
			}
			return outcome;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			close();
			throw new CancellationException("Interrupted while waiting for audit units");
		}
	}

	public int total() {
		return total;
	}

	public int delivered() {
		return delivered.get();
	}

	public boolean isCancelled() {
		return closed.get() && delivered.get() < total;
	}

	/**
	 * Cancel the run if units are still outstanding, otherwise just release resources.
	 */
	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		if (delivered.get() < total) {
			logger.info("Cancelling audit run with {}/{} units delivered", delivered.get(), total);
			executors.forEach(ExecutorService::shutdownNow);
		}
		else {
			shutdown();
		}
	}

	private void shutdown() {
		executors.forEach(ExecutorService::shutdown);
	}

}
