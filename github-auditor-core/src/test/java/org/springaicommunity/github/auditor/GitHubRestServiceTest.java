package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for GitHubRestService against an in-memory client. NO real GitHub API calls.
 */
@DisplayName("GitHubRestService Tests")
class GitHubRestServiceTest {

	private StubGitHubClient client;

	private GitHubRestService service;

	@BeforeEach
	void setUp() {
		ObjectMapper mapper = ObjectMapperFactory.create();
		client = new StubGitHubClient();
		service = new GitHubRestService(client, new PageCollector(client, mapper), mapper);
	}

	@Nested
	@DisplayName("Content Lookup Tests")
	class ContentTest {

		@Test
		@DisplayName("Should distinguish present, absent and failed lookups")
		void shouldClassifyFileLookups() {
			client.onJson("/repos/acme/api/contents/CODEOWNERS", "{}");
			client.on("/repos/acme/api/contents/.github/CODEOWNERS", new GitHubResponse(500, "{}"));

			assertThat(service.fileExists("acme", "api", "CODEOWNERS")).isEqualTo(Lookup.present(true));
			assertThat(service.fileExists("acme", "api", "docs/CODEOWNERS")).isEqualTo(Lookup.absent(false));
			assertThat(service.fileExists("acme", "api", ".github/CODEOWNERS")).isEqualTo(Lookup.degraded(false));
		}

	}

	@Nested
	@DisplayName("Branch Rules Tests")
	class BranchRulesTest {

		@Test
		@DisplayName("Should detect pull request rule with required reviewers")
		void shouldDetectRequiredReviewers() {
			client.onJson("/repos/acme/api/rules/branches/main", """
					[
					  {"type": "deletion"},
					  {"type": "pull_request", "parameters": {"required_approving_review_count": 2}}
					]
					""");

			Lookup<BranchRules> rules = service.getBranchRules("acme", "api", "main");

			assertThat(rules.status()).isEqualTo(Lookup.Status.PRESENT);
			assertThat(rules.value().allowsDirectPush()).isFalse();
			assertThat(rules.value().hasRequiredReviewers()).isTrue();
		}

		@Test
		@DisplayName("Should block direct push without requiring reviewers")
		void shouldBlockPushWithoutReviewers() {
			client.onJson("/repos/acme/api/rules/branches/main",
					"[{\"type\":\"pull_request\",\"parameters\":{\"required_approving_review_count\":0}}]");

			BranchRules rules = service.getBranchRules("acme", "api", "main").value();

			assertThat(rules.allowsDirectPush()).isFalse();
			assertThat(rules.hasRequiredReviewers()).isFalse();
		}

		@Test
		@DisplayName("Should allow direct push when there are no rules")
		void shouldAllowPushWithoutRules() {
			client.onJson("/repos/acme/api/rules/branches/main", "[]");

			assertThat(service.getBranchRules("acme", "api", "main").value()).isEqualTo(BranchRules.NONE);
			assertThat(service.getBranchRules("acme", "api", "dev")).isEqualTo(Lookup.absent(BranchRules.NONE));
		}

		@Test
		@DisplayName("Should degrade on forbidden rules endpoint")
		void shouldDegradeOnFailure() {
			client.on("/repos/acme/api/rules/branches/main", new GitHubResponse(403, "{}"));

			assertThat(service.getBranchRules("acme", "api", "main").isDegraded()).isTrue();
		}

	}

	@Nested
	@DisplayName("Listing Tests")
	class ListingTest {

		@Test
		@DisplayName("Should list admin logins with the admin permission filter")
		void shouldListAdmins() {
			client.onPages("/repos/acme/api/collaborators", "[{\"login\":\"alice\"},{\"login\":\"bob\"}]");

			Lookup<List<String>> admins = service.getAdminLogins("acme", "api");

			assertThat(admins.value()).containsExactly("alice", "bob");
			assertThat(client.requests().get(0)).contains("permission=admin");
		}

		@Test
		@DisplayName("Should report no admins when the listing fails")
		void shouldDegradeAdmins() {
			client.on("/repos/acme/api/collaborators", new GitHubResponse(403, "{}"));

			Lookup<List<String>> admins = service.getAdminLogins("acme", "api");

			assertThat(admins.isDegraded()).isTrue();
			assertThat(admins.value()).isEmpty();
		}

		@Test
		@DisplayName("Should count branches gathered before a failing page")
		void shouldCountPartialBranches() {
			client.handle("/repos/acme/api/branches", query -> "1".equals(query.get("page"))
					? new GitHubResponse(200, StubGitHubClient.jsonArray(0, 100)) : new GitHubResponse(500, "{}"));

			Lookup<Integer> count = service.countBranches("acme", "api");

			assertThat(count.value()).isEqualTo(100);
			assertThat(count.isDegraded()).isTrue();
		}

		@Test
		@DisplayName("Should map collaborator permissions to access levels")
		void shouldMapCollaborators() {
			client.onPages("/repos/acme/api/collaborators", """
					[
					  {"login": "alice", "permissions": {"admin": true, "maintain": true, "push": true, "pull": true}},
					  {"login": "bob", "permissions": {"admin": false, "maintain": true, "push": true, "pull": true}},
					  {"login": "carol", "permissions": {"admin": false, "maintain": false, "push": true, "pull": true}},
					  {"login": "dave", "permissions": {"admin": false, "maintain": false, "push": false, "pull": true}},
					  {"login": "erin"}
					]
					""");

			List<Collaborator> collaborators = service.listCollaborators("acme", "api").value();

			assertThat(collaborators).extracting(Collaborator::accessLevel)
				.containsExactly("admin", "maintain", "write", "read", "read");
		}

		@Test
		@DisplayName("Should fail organization listings on 404")
		void shouldFailOrganizationListing() {
			assertThatThrownBy(() -> service.listOrganizationMembers("ghost")).isInstanceOf(AuditException.class)
				.hasMessage("Organization 'ghost' not found.");
		}

	}

	@Nested
	@DisplayName("Member Lookup Tests")
	class MemberLookupTest {

		@Test
		@DisplayName("Should read membership role with member default")
		void shouldReadRole() {
			client.onJson("/orgs/acme/memberships/alice", "{\"role\":\"admin\"}");

			assertThat(service.getMembershipRole("acme", "alice").value()).isEqualTo("admin");
			assertThat(service.getMembershipRole("acme", "bob")).isEqualTo(Lookup.degraded("member"));
		}

		@Test
		@DisplayName("Should report N/A for missing or empty public email")
		void shouldDefaultEmail() {
			client.onJson("/users/alice", "{\"email\":\"alice@example.com\"}");
			client.onJson("/users/bob", "{\"email\":null}");
			client.onJson("/users/carol", "{\"email\":\"\"}");

			assertThat(service.getPublicEmail("alice")).isEqualTo(Lookup.present("alice@example.com"));
			assertThat(service.getPublicEmail("bob")).isEqualTo(Lookup.absent("N/A"));
			assertThat(service.getPublicEmail("carol")).isEqualTo(Lookup.absent("N/A"));
		}

		@Test
		@DisplayName("Should request only the latest public event")
		void shouldReadLatestEvent() {
			client.onJson("/users/alice/events", "[{\"created_at\":\"2024-04-20T08:15:00Z\"}]");
			client.onJson("/users/bob/events", "[]");

			assertThat(service.getLatestEventTime("alice").value())
				.contains(Instant.parse("2024-04-20T08:15:00Z"));
			assertThat(service.getLatestEventTime("bob")).isEqualTo(Lookup.absent(Optional.empty()));
			assertThat(client.requests()).contains("/users/alice/events?{per_page=1}");
		}

	}

	@Nested
	@DisplayName("Commit and Team Lookup Tests")
	class CommitAndTeamTest {

		@Test
		@DisplayName("Should read committer date of a commit")
		void shouldReadCommitDate() {
			client.onJson("/repos/acme/api/commits/abc123",
					"{\"commit\":{\"committer\":{\"date\":\"2024-03-01T10:00:00Z\"}}}");

			assertThat(service.getCommitDate("acme", "api", "abc123").value())
				.contains(Instant.parse("2024-03-01T10:00:00Z"));
			assertThat(service.getCommitDate("acme", "api", "missing").isDegraded()).isTrue();
		}

		@Test
		@DisplayName("Should read team counts")
		void shouldReadTeamCounts() {
			client.onJson("/orgs/acme/teams/core", "{\"members_count\":4,\"repos_count\":9}");

			assertThat(service.getTeamCounts("acme", "core").value()).isEqualTo(new TeamCounts(4, 9));
			assertThat(service.getTeamCounts("acme", "gone")).isEqualTo(Lookup.degraded(TeamCounts.ZERO));
		}

	}

}
