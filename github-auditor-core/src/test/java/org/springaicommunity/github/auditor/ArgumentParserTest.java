package org.springaicommunity.github.auditor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only. NO Spring context to prevent
 * accidental production operations.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private AuditProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new AuditProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should use property defaults")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.auditType).isEqualTo("repos");
			assertThat(config.concurrency).isEqualTo(5);
			assertThat(config.pageSize).isEqualTo(100);
			assertThat(config.maxRetries).isEqualTo(3);
			assertThat(config.outputFile).isNull();
			assertThat(config.verbose).isFalse();
		}

		@Test
		@DisplayName("Should parse every option")
		void shouldParseAllOptions() {
			String[] args = { "--org", "acme", "--type", "members", "--concurrency", "10", "--page-size", "50",
					"--max-retries", "1", "-o", "members.sse", "-v" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.organization).isEqualTo("acme");
			assertThat(config.auditType).isEqualTo("members");
			assertThat(config.concurrency).isEqualTo(10);
			assertThat(config.pageSize).isEqualTo(50);
			assertThat(config.maxRetries).isEqualTo(1);
			assertThat(config.outputFile).isEqualTo("members.sse");
			assertThat(config.verbose).isTrue();
			assertThat(config.isStats()).isFalse();
		}

		@Test
		@DisplayName("Should accept stats type")
		void shouldAcceptStatsType() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "-g", "acme", "-t", "STATS" });

			assertThat(config.isStats()).isTrue();
		}

		@Test
		@DisplayName("Should count max-attempts as retries plus the first request")
		void shouldMapMaxAttemptsToRetries() {
			assertThat(argumentParser.parseAndValidate(new String[] { "--max-attempts", "1" }).maxRetries).isZero();
			assertThat(argumentParser.parseAndValidate(new String[] { "--max-attempts", "4" }).maxRetries).isEqualTo(3);
			assertThat(argumentParser.parseAndValidate(new String[] { "--max-retries", "4" }).maxRetries).isEqualTo(4);
		}

		@Test
		@DisplayName("Should require at least one attempt")
		void shouldRejectZeroAttempts() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--max-attempts", "0" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid max attempts '0'");
		}

		@Test
		@DisplayName("Should copy engine settings onto properties")
		void shouldApplySettings() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "-c", "2", "--page-size", "25", "--max-retries", "4" });

			AuditProperties applied = config.applyTo(new AuditProperties());

			assertThat(applied.getConcurrency()).isEqualTo(2);
			assertThat(applied.getPageSize()).isEqualTo(25);
			assertThat(applied.getMaxRetries()).isEqualTo(4);
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@ParameterizedTest
		@ValueSource(strings = { "0", "-3", "many" })
		@DisplayName("Should reject invalid concurrency")
		void shouldRejectInvalidConcurrency(String value) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--concurrency", value }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("concurrency");
		}

		@Test
		@DisplayName("Should reject page size above GitHub's maximum")
		void shouldRejectLargePageSize() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--page-size", "101" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Page size must be between 1 and 100");
		}

		@Test
		@DisplayName("Should reject unknown audit type")
		void shouldRejectUnknownType() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--type", "issues" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("repos, branches, access, members, teams, stats");
		}

		@ParameterizedTest
		@ValueSource(strings = { "-acme", "acme/repo", "acme-", "a b" })
		@DisplayName("Should reject malformed organization names")
		void shouldRejectMalformedOrganization(String org) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--org", org }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Organization must be a GitHub login");
		}

		@Test
		@DisplayName("Should reject missing option value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--org" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for org option");
		}

		@Test
		@DisplayName("Should reject unknown options")
		void shouldRejectUnknownOption() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--zip" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown option: --zip");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help flags")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--org", "acme", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--org", "acme" })).isFalse();
		}

		@Test
		@DisplayName("Should document every option with current defaults")
		void shouldGenerateHelp() {
			defaultProperties.setConcurrency(8);

			String help = argumentParser.generateHelpText();

			assertThat(help).contains("--org", "--type", "--concurrency", "--page-size", "--max-retries",
					"--max-attempts", "--output", "GITHUB_TOKEN", "(default: 8)");
		}

	}

}
