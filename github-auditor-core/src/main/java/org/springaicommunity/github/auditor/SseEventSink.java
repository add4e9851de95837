package org.springaicommunity.github.auditor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes events as server-sent-event frames to an output stream, flushing after each
 * frame so consumers see every unit as soon as it finishes.
 *
 * <p>
 * A {@link PrintStream} such as {@code System.out} never throws; its error flag is checked
 * after every frame so a closed pipe still surfaces as an {@link IOException}.
 */
public class SseEventSink implements EventSink {

	private static final Logger logger = LoggerFactory.getLogger(SseEventSink.class);

	private final OutputStream out;

	private final AuditEventCodec codec;

	public SseEventSink(OutputStream out, AuditEventCodec codec) {
		this.out = out;
		this.codec = codec;
	}

	@Override
	public synchronized void send(AuditEvent event) throws IOException {
		String frame = codec.frame(event);
		logger.trace("Sending {}", frame.trim());
		out.write(frame.getBytes(StandardCharsets.UTF_8));
		out.flush();
		if (out instanceof PrintStream && ((PrintStream) out).checkError()) {
			throw new IOException("Event consumer closed the output stream");
		}
	}

}
