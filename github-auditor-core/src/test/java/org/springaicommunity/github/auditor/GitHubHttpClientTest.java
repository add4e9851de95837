package org.springaicommunity.github.auditor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GitHubHttpClient Tests")
class GitHubHttpClientTest {

	@Test
	@DisplayName("Should prefix paths with the API base URL")
	void shouldBuildUrlFromPath() {
		GitHubHttpClient client = new GitHubHttpClient("token", "https://github.example.com/api/v3/");

		assertThat(client.buildUrl("/orgs/acme/repos", Map.of()))
			.isEqualTo("https://github.example.com/api/v3/orgs/acme/repos");
	}

	@Test
	@DisplayName("Should encode query parameters in order")
	void shouldEncodeQuery() {
		GitHubHttpClient client = new GitHubHttpClient("token");
		Map<String, String> query = new LinkedHashMap<>();
		query.put("permission", "admin");
		query.put("per_page", "100");
		query.put("q", "a b&c");

		assertThat(client.buildUrl("/repos/acme/api/collaborators", query))
			.isEqualTo("https://api.github.com/repos/acme/api/collaborators?permission=admin&per_page=100&q=a+b%26c");
	}

	@Test
	@DisplayName("Should keep absolute URLs")
	void shouldKeepAbsoluteUrls() {
		GitHubHttpClient client = new GitHubHttpClient("token");

		assertThat(client.buildUrl("https://api.github.com/orgs/acme/repos?type=all", Map.of("page", "2")))
			.isEqualTo("https://api.github.com/orgs/acme/repos?type=all&page=2");
	}

	@Test
	@DisplayName("Should treat only 403 as a rate-limit signal")
	void shouldDetectRateLimitSignal() {
		assertThat(RateLimitSignal.from(new GitHubResponse(403, "{}", 0, 1700000000L)))
			.contains(new RateLimitSignal(1700000000L));
		assertThat(RateLimitSignal.from(new GitHubResponse(403, "{}"))).hasValueSatisfying(
				signal -> assertThat(signal.hasResetTime()).isFalse());
		assertThat(RateLimitSignal.from(new GitHubResponse(429, "{}"))).isEmpty();
		assertThat(RateLimitSignal.from(new GitHubResponse(200, "[]"))).isEmpty();
	}

	@Test
	@DisplayName("Should flag a low remaining quota")
	void shouldFlagLowQuota() {
		RateLimitInfo low = new RateLimitInfo(5000, 99, 1700000000L, 4901);
		RateLimitInfo plenty = new RateLimitInfo(5000, 100, 1700000000L, 4900);

		assertThat(low.isLow()).isTrue();
		assertThat(plenty.isLow()).isFalse();
		assertThat(low.getResetTime()).isEqualTo(Instant.ofEpochSecond(1700000000L));
	}

}
