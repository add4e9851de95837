package org.springaicommunity.github.auditor;

import java.io.IOException;

/**
 * Transport receiving audit events one at a time.
 *
 * <p>
 * {@link #send} may block; the emitter does not buffer, so a slow sink slows the whole
 * run. An {@link IOException} means the consumer is gone and cancels the run.
 */
@FunctionalInterface
public interface EventSink {

	void send(AuditEvent event) throws IOException;

}
