package org.springaicommunity.github.auditor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser for the organization audit tool. Pure Java implementation
 * with no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	public static final String STATS_TYPE = "stats";

	private final AuditProperties defaultProperties;

	public ArgumentParser(AuditProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-g", "--org":
					config.organization = getRequiredValue(args, i, "org");
					i++; // Skip next argument since we consumed it
					break;

				case "-t", "--type":
					String type = getRequiredValue(args, i, "type").toLowerCase(Locale.ROOT);
					if (!validTypes().contains(type)) {
						throw new IllegalArgumentException(
								"Invalid audit type '" + type + "': must be one of " + String.join(", ", validTypes()));
					}
					config.auditType = type;
					i++;
					break;

				case "-c", "--concurrency":
					config.concurrency = parsePositive(getRequiredValue(args, i, "concurrency"), "concurrency");
					i++;
					break;

				case "--page-size":
					config.pageSize = parsePositive(getRequiredValue(args, i, "page-size"), "page size");
					i++;
					break;

				case "--max-retries":
					String retries = getRequiredValue(args, i, "max-retries");
					try {
						config.maxRetries = Integer.parseInt(retries);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max retries '" + retries + "': must be a non-negative integer");
					}
					i++;
					break;

				case "--max-attempts":
					// Total requests per call: the first one plus the retries
					config.maxRetries = parsePositive(getRequiredValue(args, i, "max-attempts"), "max attempts") - 1;
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-auditor [OPTIONS]\n");
		help.append("\n");
		help.append("Audit the security posture of a GitHub organization. Results are streamed as\n");
		help.append("Server-Sent Events frames while repositories, members or teams are processed.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("    -g, --org ORG            Organization to audit (default: $GITHUB_ORG)\n");
		help.append("    -t, --type TYPE          Audit type: ")
			.append(String.join(", ", validTypes()))
			.append(" (default: repos)\n");
		help.append("    -c, --concurrency N      Audit units running at once (default: ")
			.append(defaultProperties.getConcurrency())
			.append(")\n");
		help.append("    --page-size N            Items per page, 1-100 (default: ")
			.append(defaultProperties.getPageSize())
			.append(")\n");
		help.append("    --max-retries N          Rate-limit retries per request (default: ")
			.append(defaultProperties.getMaxRetries())
			.append(")\n");
		help.append("    --max-attempts N         Total requests per call, i.e. retries + 1 (default: ")
			.append(defaultProperties.getMaxRetries() + 1)
			.append(")\n");
		help.append("    -o, --output FILE        Write the event stream to FILE instead of stdout\n");
		help.append("    -v, --verbose            Log at DEBUG level, with stack traces on failure\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN             GitHub personal access token (required)\n");
		help.append("    GITHUB_ORG               Default organization\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-auditor --org my-org\n");
		help.append("    github-auditor --org my-org --type members --concurrency 10\n");
		help.append("    github-auditor --org my-org --type branches -o branches.sse\n");
		help.append("    github-auditor --org my-org --type stats\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token, etc.)
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		if (EnvironmentSupport.token() == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
	}

	static List<String> validTypes() {
		List<String> types = new ArrayList<>();
		for (AuditKind kind : AuditKind.values()) {
			types.add(kind.id());
		}
		types.add(STATS_TYPE);
		return types;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String name) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be positive");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.organization != null && !config.organization.matches("^[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?$")) {
			errors.add("Organization must be a GitHub login (letters, digits and inner hyphens), got '"
					+ config.organization + "'");
		}

		if (config.concurrency <= 0) {
			errors.add("Concurrency must be positive (got: " + config.concurrency + ")");
		}

		if (config.pageSize <= 0 || config.pageSize > PageRequest.MAX_PAGE_SIZE) {
			errors.add("Page size must be between 1 and " + PageRequest.MAX_PAGE_SIZE + " (got: " + config.pageSize
					+ ")");
		}

		if (config.maxRetries < 0) {
			errors.add("Max retries must not be negative (got: " + config.maxRetries + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
