package org.springaicommunity.github.auditor;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Target, falls back to GITHUB_ORG when not given
	public @Nullable String organization = null;

	// Audit type: one of the AuditKind ids, or "stats"
	public String auditType = "repos";

	// Engine settings
	public int concurrency;

	public int pageSize;

	public int maxRetries;

	// Output
	public @Nullable String outputFile = null; // stdout when null

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(AuditProperties defaultProperties) {
		this.concurrency = defaultProperties.getConcurrency();
		this.pageSize = defaultProperties.getPageSize();
		this.maxRetries = defaultProperties.getMaxRetries();
	}

	public boolean isStats() {
		return ArgumentParser.STATS_TYPE.equals(auditType);
	}

	/**
	 * Copy the engine settings onto a properties object. Verbosity only affects the CLI's
	 * log level and is not copied.
	 */
	public AuditProperties applyTo(AuditProperties properties) {
		properties.setConcurrency(concurrency);
		properties.setPageSize(pageSize);
		properties.setMaxRetries(maxRetries);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "organization='" + organization + '\'' + ", auditType='" + auditType + '\''
				+ ", concurrency=" + concurrency + ", pageSize=" + pageSize + ", maxRetries=" + maxRetries
				+ ", outputFile='" + outputFile + '\'' + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ '}';
	}

}
