package org.springaicommunity.github.auditor;

/**
 * Whole-run failure raised while loading an audit's entity list. Carries a
 * user-facing detail message that is forwarded to the caller as an {@code error} event.
 */
public class AuditException extends RuntimeException {

	/**
	 * Why the run could not start.
	 */
	public enum Reason {

		INVALID_CREDENTIALS, NOT_FOUND, UPSTREAM_FAILURE

	}

	private final Reason reason;

	private final int statusCode;

	public AuditException(Reason reason, int statusCode, String detail) {
		super(detail);
		this.reason = reason;
		this.statusCode = statusCode;
	}

	public static AuditException invalidCredentials() {
		return new AuditException(Reason.INVALID_CREDENTIALS, 401, "Invalid GitHub token.");
	}

	public static AuditException organizationNotFound(String organization) {
		return new AuditException(Reason.NOT_FOUND, 404, "Organization '" + organization + "' not found.");
	}

	public static AuditException upstreamFailure(int statusCode, String body) {
		return new AuditException(Reason.UPSTREAM_FAILURE, statusCode, "GitHub API error: " + body);
	}

	public Reason getReason() {
		return reason;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getDetail() {
		return getMessage();
	}

}
