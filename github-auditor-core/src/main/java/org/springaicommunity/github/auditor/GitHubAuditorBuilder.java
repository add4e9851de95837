package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for creating a {@link GitHubAuditor} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Simple usage with environment variable
 * GitHubAuditor auditor = GitHubAuditorBuilder.create()
 *     .tokenFromEnv()
 *     .build();
 *
 * // With custom configuration
 * AuditProperties props = new AuditProperties();
 * props.setConcurrency(10);
 *
 * GitHubAuditor auditor = GitHubAuditorBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .build();
 *
 * // Stream a repository audit to stdout
 * auditor.stream(AuditKind.REPOS, "my-org", new SseEventSink(System.out, codec));
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * GitHubAuditor testAuditor = GitHubAuditorBuilder.create()
 *     .httpClient(mockClient)
 *     .sleeper(duration -> {})
 *     .build();
 * }
 * </pre>
 */
public class GitHubAuditorBuilder {

	private @Nullable String token;

	private AuditProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable AuditPermits permits;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.THREAD;

	private GitHubAuditorBuilder() {
		this.properties = new AuditProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubAuditorBuilder
	 */
	public static GitHubAuditorBuilder create() {
		return new GitHubAuditorBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public GitHubAuditorBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from GITHUB_TOKEN ({@code .env} file or environment).
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public GitHubAuditorBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.token();
		if (this.token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set audit properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public GitHubAuditorBuilder properties(@Nullable AuditProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubAuditorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks. The client
	 * is still wrapped with rate-limit retries.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubAuditorBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Share permit pools with other auditors, e.g. one set per server process.
	 * @param permits pools per audit kind (null to create pools from the properties)
	 * @return this builder
	 */
	public GitHubAuditorBuilder permits(@Nullable AuditPermits permits) {
		this.permits = permits;
		return this;
	}

	public GitHubAuditorBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public GitHubAuditorBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the GitHubAuditor.
	 * @return configured GitHubAuditor
	 * @throws IllegalStateException if neither a token nor a client was provided
	 */
	public GitHubAuditor build() {
		validateToken();
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient base = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(requireToken(), properties.getApiBaseUrl());

		GitHubClient client = RetryingGitHubClient.builder()
			.wrapping(base)
			.maxRetries(properties.getMaxRetries())
			.maxResetWait(properties.getMaxResetWait())
			.fallbackStep(properties.getFallbackStep())
			.clock(clock)
			.sleeper(sleeper)
			.build();

		RestService restService = new GitHubRestService(client,
				new PageCollector(client, mapper, properties.getPageSize()), mapper);
		AuditPermits pools = this.permits != null ? this.permits
				: AuditPermits.withCeiling(properties.getConcurrency());
		return new GitHubAuditor(restService, client, new AuditEventEmitter(new FanOutScheduler()), pools, clock,
				properties.getInactiveDaysDefault());
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

	private String requireToken() {
		if (token == null) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		return token;
	}

}
