package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AuditEventCodec Tests")
class AuditEventCodecTest {

	private final ObjectMapper mapper = ObjectMapperFactory.create();

	private AuditEventCodec codec(AuditKind kind) {
		return new AuditEventCodec(mapper, kind.vocabulary());
	}

	@Nested
	@DisplayName("Vocabulary Tests")
	class VocabularyTest {

		@Test
		@DisplayName("Should name repository audit fields")
		void shouldUseRepositoryVocabulary() {
			AuditEventCodec codec = codec(AuditKind.REPOS);

			assertThat(codec.frame(AuditEvent.start(3))).isEqualTo("data: {\"type\":\"start\",\"total_repos\":3}\n\n");
			assertThat(codec.frame(AuditEvent.progress("api", 1)))
				.isEqualTo("data: {\"type\":\"progress\",\"repo\":\"api\",\"processed\":1}\n\n");
			assertThat(codec.frame(AuditEvent.done())).isEqualTo("data: {\"type\":\"done\"}\n\n");
		}

		@Test
		@DisplayName("Should name member and team audit fields")
		void shouldUseMemberAndTeamVocabulary() {
			assertThat(codec(AuditKind.MEMBERS).toJson(AuditEvent.start(7)).has("total_members")).isTrue();
			assertThat(codec(AuditKind.MEMBERS).toJson(AuditEvent.progress("octocat", 2)).get("member").asText())
				.isEqualTo("octocat");
			assertThat(codec(AuditKind.TEAMS).toJson(AuditEvent.start(2)).has("total_teams")).isTrue();
			assertThat(codec(AuditKind.TEAMS).toJson(AuditEvent.data("x")).has("team_data")).isTrue();
			assertThat(codec(AuditKind.ACCESS).toJson(AuditEvent.data(List.of())).has("access_data")).isTrue();
		}

		@Test
		@DisplayName("Should carry error detail")
		void shouldEncodeError() {
			assertThat(codec(AuditKind.REPOS).frame(AuditEvent.error("Invalid GitHub token.")))
				.isEqualTo("data: {\"type\":\"error\",\"detail\":\"Invalid GitHub token.\"}\n\n");
		}

	}

	@Nested
	@DisplayName("Payload Tests")
	class PayloadTest {

		@Test
		@DisplayName("Should serialize repository records in snake case")
		void shouldSerializeRepositoryRecord() {
			RepositoryAudit audit = new RepositoryAudit("api", "acme", null, "java, security", true, false, "main",
					"Java", 10, 2, 1, "alice", true, true, false, "https://github.com/acme/api", 4, List.of());

			JsonNode json = codec(AuditKind.REPOS).toJson(AuditEvent.data(audit)).get("repo_data");

			assertThat(json.get("repository").asText()).isEqualTo("api");
			assertThat(json.get("private").asBoolean()).isTrue();
			assertThat(json.get("admin_count").asInt()).isEqualTo(1);
			assertThat(json.get("has_required_reviewers").asBoolean()).isTrue();
			assertThat(json.get("allows_direct_push").asBoolean()).isFalse();
			assertThat(json.get("branch_count").asInt()).isEqualTo(4);
			assertThat(json.get("description").isNull()).isTrue();
			assertThat(json.get("degraded_fields").isArray()).isTrue();
		}

		@Test
		@DisplayName("Should serialize branch lists")
		void shouldSerializeBranchList() {
			BranchRecord branch = new BranchRecord("api", "main", "2024-04-01", 30L, true, List.of());

			JsonNode json = codec(AuditKind.BRANCHES).toJson(AuditEvent.data(List.of(branch))).get("branches");

			assertThat(json.isArray()).isTrue();
			assertThat(json.get(0).get("branch_name").asText()).isEqualTo("main");
			assertThat(json.get(0).get("last_commit_date").asText()).isEqualTo("2024-04-01");
			assertThat(json.get(0).get("protected").asBoolean()).isTrue();
		}

	}

	@Test
	@DisplayName("Should write and flush one frame per event")
	void shouldWriteFrames() throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		SseEventSink sink = new SseEventSink(out, codec(AuditKind.REPOS));

		sink.send(AuditEvent.start(1));
		sink.send(AuditEvent.done());

		assertThat(out.toString(StandardCharsets.UTF_8))
			.isEqualTo("data: {\"type\":\"start\",\"total_repos\":1}\n\ndata: {\"type\":\"done\"}\n\n");
	}

	@Test
	@DisplayName("Should report a failed print stream as an IOException")
	void shouldDetectFailedPrintStream() {
		OutputStream closedPipe = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("Broken pipe");
			}
		};
		SseEventSink sink = new SseEventSink(new PrintStream(closedPipe), codec(AuditKind.REPOS));

		assertThatThrownBy(() -> sink.send(AuditEvent.start(3))).isInstanceOf(IOException.class)
			.hasMessage("Event consumer closed the output stream");
	}

}
