package org.springaicommunity.github.auditor;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Member activity audit. Each unit looks up the member's role, public email and latest
 * public event concurrently.
 */
public class MemberAuditWorkflow extends AbstractAuditWorkflow<JsonNode, MemberAudit> {

	static final String NO_RECENT_ACTIVITY = "No recent activity";

	private final long inactiveDaysDefault;

	public MemberAuditWorkflow(RestService restService, Clock clock, long inactiveDaysDefault) {
		super(restService, clock);
		this.inactiveDaysDefault = inactiveDaysDefault;
	}

	@Override
	public AuditKind kind() {
		return AuditKind.MEMBERS;
	}

	@Override
	public List<JsonNode> loadEntities(String organization) {
		return restService.listOrganizationMembers(organization);
	}

	@Override
	public String identify(JsonNode member) {
		return JsonNodeUtils.getString(member, "login", "");
	}

	@Override
	public MemberAudit audit(UnitContext context, String organization, JsonNode member) throws Exception {
		String username = identify(member);

		CompletableFuture<Lookup<String>> role = context
			.fork(() -> restService.getMembershipRole(organization, username));
		CompletableFuture<Lookup<String>> email = context.fork(() -> restService.getPublicEmail(username));
		CompletableFuture<Lookup<Optional<Instant>>> activity = context
			.fork(() -> restService.getLatestEventTime(username));
		context.awaitAll(role, email, activity);

		Lookup<String> roleLookup = context.join(role);
		Lookup<String> emailLookup = context.join(email);
		Lookup<Optional<Instant>> activityLookup = context.join(activity);

		Map<String, Lookup<?>> fields = fields();
		fields.put("role", roleLookup);
		fields.put("email", emailLookup);
		fields.put("last_activity", activityLookup);

		Optional<Instant> latest = activityLookup.value();
		return new MemberAudit(username, roleLookup.value(), emailLookup.value(),
				latest.map(AbstractAuditWorkflow::formatDay).orElse(NO_RECENT_ACTIVITY),
				latest.map(this::daysSince).orElse(inactiveDaysDefault), degradedFields(fields));
	}

	@Override
	public MemberAudit degrade(String organization, JsonNode member, Exception cause) {
		return new MemberAudit(identify(member), "member", "N/A", NO_RECENT_ACTIVITY, inactiveDaysDefault,
				List.of("role", "email", "last_activity"));
	}

	@Override
	public boolean hasData(MemberAudit result) {
		return true;
	}

}
