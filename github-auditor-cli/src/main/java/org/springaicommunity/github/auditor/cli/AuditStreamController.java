package org.springaicommunity.github.auditor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.auditor.AuditEventCodec;
import org.springaicommunity.github.auditor.AuditException;
import org.springaicommunity.github.auditor.AuditKind;
import org.springaicommunity.github.auditor.AuditSummary;
import org.springaicommunity.github.auditor.GitHubAuditor;
import org.springaicommunity.github.auditor.GitHubHttpClient;
import org.springaicommunity.github.auditor.OrganizationStats;
import org.springaicommunity.github.auditor.SseEventSink;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.util.Map;

/**
 * HTTP surface of the auditor.
 *
 * <ul>
 * <li>{@code GET /api/stats/basic} with headers {@code gh-token} and {@code gh-org}</li>
 * <li>{@code GET /api/audit/{kind}/stream?gh_token=&gh_org=} streaming
 * {@code text/event-stream} frames while the audit runs</li>
 * </ul>
 *
 * Failures of a stream are reported in-band as an {@code error} event; failures of the
 * stats call map to the HTTP status with a {@code {"detail": ...}} body, 502 when GitHub
 * could not be reached.
 */
@RestController
@RequestMapping("/api")
public class AuditStreamController {

	private static final Logger logger = LoggerFactory.getLogger(AuditStreamController.class);

	private final AuditorFactory auditorFactory;

	private final ObjectMapper objectMapper;

	public AuditStreamController(AuditorFactory auditorFactory, ObjectMapper objectMapper) {
		this.auditorFactory = auditorFactory;
		this.objectMapper = objectMapper;
	}

	@GetMapping("/stats/basic")
	public OrganizationStats basicStats(@RequestHeader("gh-token") String token,
			@RequestHeader("gh-org") String organization) {
		return auditorFactory.create(token).basicStats(organization);
	}

	@GetMapping("/audit/{kind}/stream")
	public ResponseEntity<StreamingResponseBody> stream(@PathVariable("kind") String kindId,
			@RequestParam("gh_token") String token, @RequestParam("gh_org") String organization) {
		AuditKind kind = AuditKind.fromId(kindId);
		GitHubAuditor auditor = auditorFactory.create(token);
		AuditEventCodec codec = new AuditEventCodec(objectMapper, kind.vocabulary());

		StreamingResponseBody body = out -> {
			try {
				AuditSummary summary = auditor.stream(kind, organization, new SseEventSink(out, codec));
				logger.info("{} stream for {} finished: {}", kind.id(), organization, summary);
			}
			catch (IOException e) {
				logger.info("{} stream for {} closed by client", kind.id(), organization);
				throw e;
			}
		};

		return ResponseEntity.ok()
			.contentType(MediaType.TEXT_EVENT_STREAM)
			.cacheControl(CacheControl.noCache())
			.header("X-Accel-Buffering", "no")
			.body(body);
	}

	@ExceptionHandler(AuditException.class)
	public ResponseEntity<Map<String, String>> handleAuditException(AuditException e) {
		HttpStatus status = HttpStatus.resolve(e.getStatusCode());
		if (status == null || e.getReason() == AuditException.Reason.UPSTREAM_FAILURE) {
			status = HttpStatus.BAD_GATEWAY;
		}
		logger.warn("Request failed with {}: {}", status.value(), e.getDetail());
		return ResponseEntity.status(status).body(Map.of("detail", e.getDetail()));
	}

	@ExceptionHandler(GitHubHttpClient.GitHubApiException.class)
	public ResponseEntity<Map<String, String>> handleTransportFailure(GitHubHttpClient.GitHubApiException e) {
		logger.error("Could not reach GitHub: {}", e.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
			.body(Map.of("detail", "GitHub API unreachable: " + e.getMessage()));
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
		return ResponseEntity.badRequest().body(Map.of("detail", e.getMessage()));
	}

}
