package org.springaicommunity.github.auditor.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.auditor.*;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * GitHub Auditor CLI Application
 *
 * Plain Java command-line application that streams a security audit of a GitHub
 * organization. No Spring dependencies - uses GitHubAuditorBuilder for service wiring.
 * Events are written to stdout (or the output file) as Server-Sent Events frames; logs go
 * to stderr.
 *
 * Usage: java -jar github-auditor-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication,
 * GITHUB_ORG - default organization
 *
 * Examples: java -jar github-auditor-cli.jar --org my-org java -jar
 * github-auditor-cli.jar --org my-org --type branches -o branches.sse java -jar
 * github-auditor-cli.jar --org my-org --type stats
 */
public class GitHubAuditorCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAuditorCli.class);

	static final String AUDITOR_LOGGER = "org.springaicommunity.github.auditor";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Audit failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, System.out);
	}

	static int run(String[] args, PrintStream stdout) throws Exception {
		// Create argument parser with default properties
		AuditProperties properties = new AuditProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			stdout.println(argumentParser.generateHelpText());
			return 0;
		}

		// Parse and validate arguments
		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		String organization = config.organization != null ? config.organization : EnvironmentSupport.organization();
		if (organization == null) {
			throw new IllegalArgumentException(
					"Organization is required: pass --org or set the GITHUB_ORG environment variable");
		}
		argumentParser.validateEnvironment();

		if (config.verbose) {
			enableDebugLogging();
		}
		logConfiguration(config, organization);

		ObjectMapper objectMapper = ObjectMapperFactory.create();
		GitHubAuditor auditor = GitHubAuditorBuilder.create()
			.tokenFromEnv()
			.objectMapper(objectMapper)
			.properties(config.applyTo(properties))
			.build();

		try {
			if (config.isStats()) {
				return printStats(auditor, organization, objectMapper, stdout);
			}
			return streamAudit(auditor, AuditKind.fromId(config.auditType), organization, config, objectMapper,
					stdout);
		}
		catch (AuditException e) {
			logger.error("Audit failed: {}", e.getDetail());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}
		finally {
			logRateLimit(auditor);
		}
	}

	private static int printStats(GitHubAuditor auditor, String organization, ObjectMapper objectMapper,
			PrintStream stdout) throws IOException {
		OrganizationStats stats = auditor.basicStats(organization);
		stdout.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(stats));
		stdout.flush();
		return 0;
	}

	private static int streamAudit(GitHubAuditor auditor, AuditKind kind, String organization,
			ParsedConfiguration config, ObjectMapper objectMapper, PrintStream stdout) throws IOException {
		AuditEventCodec codec = new AuditEventCodec(objectMapper, kind.vocabulary());
		AuditSummary summary;
		if (config.outputFile != null) {
			Path outputPath = Paths.get(config.outputFile);
			try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
				summary = auditor.stream(kind, organization, new SseEventSink(out, codec));
			}
			logger.info("Event stream written to {}", outputPath.toAbsolutePath());
		}
		else {
			summary = auditor.stream(kind, organization, new SseEventSink(stdout, codec));
		}

		logSummary(kind, summary);
		return summary.succeeded() ? 0 : 1;
	}

	/**
	 * Raise the auditor's loggers to DEBUG so every GitHub call and backoff is logged.
	 */
	static void enableDebugLogging() {
		Logger auditorLogger = LoggerFactory.getLogger(AUDITOR_LOGGER);
		if (auditorLogger instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) auditorLogger).setLevel(Level.DEBUG);
		}
		else {
			logger.warn("Verbose logging needs Logback, found {}", auditorLogger.getClass().getName());
		}
	}

	private static void logConfiguration(ParsedConfiguration config, String organization) {
		logger.info("Configuration:");
		logger.info("  Organization: {}", organization);
		logger.info("  Audit type: {}", config.auditType);
		logger.info("  Concurrency: {}", config.concurrency);
		logger.info("  Page size: {}", config.pageSize);
		logger.info("  Max retries: {}", config.maxRetries);
		logger.info("  Output file: {}", config.outputFile != null ? config.outputFile : "(stdout)");
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logSummary(AuditKind kind, AuditSummary summary) {
		if (!summary.succeeded()) {
			logger.error("{} audit failed: {}", kind.id(), summary.error());
			return;
		}
		logger.info("{} audit completed!", kind.id());
		logger.info("  Units: {}", summary.total());
		logger.info("  Processed: {}", summary.processed());
		logger.info("  Data events: {}", summary.dataEvents());
		if (summary.degraded() > 0) {
			logger.warn("  Degraded units: {}", summary.degraded());
		}
	}

	private static void logRateLimit(GitHubAuditor auditor) {
		RateLimitInfo rateLimit = auditor.lastRateLimitInfo();
		if (rateLimit != null) {
			logger.info("GitHub rate limit: {}/{} remaining, resets at {}", rateLimit.remaining(), rateLimit.limit(),
					rateLimit.getResetTime());
		}
	}

}
