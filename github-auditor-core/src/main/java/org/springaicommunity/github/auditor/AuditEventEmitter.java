package org.springaicommunity.github.auditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Turns an {@link AuditWorkflow} into an incremental event stream.
 *
 * <p>
 * The entity list is loaded first (its size is the {@code start} total), then one unit
 * per entity is run through the {@link FanOutScheduler}. Every finished unit produces a
 * {@code progress} event immediately followed, when the unit has data, by a {@code data}
 * event. {@code done} is sent once every unit has been reported. Events are sent on the
 * calling thread in completion order; nothing is reordered or buffered.
 *
 * <p>
 * When the sink fails with an {@link IOException} (consumer disconnected) the run is
 * cancelled: units that have not started never start and running units are interrupted.
 */
public class AuditEventEmitter {

	private static final Logger logger = LoggerFactory.getLogger(AuditEventEmitter.class);

	private final FanOutScheduler scheduler;

	public AuditEventEmitter(FanOutScheduler scheduler) {
		this.scheduler = scheduler;
	}

	/**
	 * Run an audit and stream its events.
	 * @param organization the organization to audit
	 * @param workflow what to audit
	 * @param permits concurrency ceiling for the units
	 * @param sink where events go
	 * @return summary of the run
	 * @throws IOException if the sink failed; the run has been cancelled
	 */
	public <E, R> AuditSummary emit(String organization, AuditWorkflow<E, R> workflow, PermitPool permits,
			EventSink sink) throws IOException {
		String kind = workflow.kind().id();
		long start = System.currentTimeMillis();
		logger.info("Starting {} audit for organization {}", kind, organization);

		List<E> entities;
		try {
			entities = workflow.loadEntities(organization);
		}
		catch (AuditException e) {
			logger.warn("{} audit for {} failed before fan-out: {}", kind, organization, e.getDetail());
			sink.send(AuditEvent.error(e.getDetail()));
			return AuditSummary.failed(e.getDetail());
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			logger.error("{} audit for {} could not reach GitHub: {}", kind, organization, e.getMessage());
			sink.send(AuditEvent.error(e.getMessage()));
			return AuditSummary.failed(String.valueOf(e.getMessage()));
		}

		List<WorkUnit<R>> units = entities.stream().map(entity -> toUnit(organization, workflow, entity))
			.collect(Collectors.toList());
		sink.send(AuditEvent.start(units.size()));

		AtomicInteger processed = new AtomicInteger();
		int dataEvents = 0;
		int degraded = 0;
		try (CompletionStream<R> stream = scheduler.run(units, permits)) {
			while (stream.hasNext()) {
				UnitOutcome<R> outcome = stream.next();
				sink.send(AuditEvent.progress(outcome.key(), processed.incrementAndGet()));
				if (outcome.isDegraded()) {
					degraded++;
				}
				R result = outcome.result();
				if (result != null && workflow.hasData(result)) {
					sink.send(AuditEvent.data(result));
					dataEvents++;
				}
			}
		}
		catch (IOException e) {
			logger.info("{} audit for {} cancelled after {}/{} units: consumer disconnected ({})", kind, organization,
					processed.get(), units.size(), e.getMessage());
			throw e;
		}
		sink.send(AuditEvent.done());

		logger.info("{} audit for {} completed: {} units, {} data events, {} degraded in {}ms", kind, organization,
				units.size(), dataEvents, degraded, System.currentTimeMillis() - start);
		return new AuditSummary(units.size(), processed.get(), dataEvents, degraded, null);
	}

	private static <E, R> WorkUnit<R> toUnit(String organization, AuditWorkflow<E, R> workflow, E entity) {
		return WorkUnit.of(workflow.identify(entity), context -> workflow.audit(context, organization, entity),
				cause -> workflow.degrade(organization, entity, cause));
	}

}
