package org.springaicommunity.github.auditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Lets a running unit issue its sub-requests concurrently.
 *
 * <p>
 * Sub-requests run on a pool shared by all units of one scheduler run. A unit is only
 * complete once every sub-request it forked has finished, so units should call
 * {@link #awaitAll} before reading results with {@link #join}.
 */
public class UnitContext {

	private static final Logger logger = LoggerFactory.getLogger(UnitContext.class);

	private final Executor subRequestExecutor;

	public UnitContext(Executor subRequestExecutor) {
		this.subRequestExecutor = subRequestExecutor;
	}

	/**
	 * Start a sub-request on the shared pool.
	 * @param subRequest the call to make
	 * @return a future completed with the call's result or failure
	 */
	public <T> CompletableFuture<T> fork(Callable<T> subRequest) {
		CompletableFuture<T> future = new CompletableFuture<>();
		subRequestExecutor.execute(() -> {
			try {
				future.complete(subRequest.call());
			}
			catch (Exception e) {
				future.completeExceptionally(e);
			}
		});
		return future;
	}

	/**
	 * Wait until every given sub-request has finished, successfully or not. Failures are
	 * not raised here; they surface when the individual result is read with
	 * {@link #join}.
	 * @throws InterruptedException if the unit is cancelled while waiting
	 */
	public void awaitAll(CompletableFuture<?>... futures) throws InterruptedException {
		try {
			CompletableFuture.allOf(futures).get();
		}
		catch (ExecutionException e) {
			logger.debug("Sub-request failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
		}
	}

	/**
	 * Read a sub-request's result, waiting if needed.
	 * @throws Exception the sub-request's own failure
	 */
	public <T> T join(CompletableFuture<T> future) throws Exception {
		try {
			return future.get();
		}
		catch (ExecutionException e) {
			if (e.getCause() instanceof Exception) {
				throw (Exception) e.getCause();
			}
			throw e;
		}
	}

}
