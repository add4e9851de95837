package org.springaicommunity.github.auditor;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables by checking a {@code .env} file first, then the system
 * environment, then a {@code .env} file in the user's home directory. The files are loaded
 * once and cached for the lifetime of the process.
 */
public final class EnvironmentSupport {

	public static final String TOKEN_VARIABLE = "GITHUB_TOKEN";

	public static final String ORGANIZATION_VARIABLE = "GITHUB_ORG";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		// Dotenv also consults the system environment
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * The GitHub token from {@value #TOKEN_VARIABLE}, or {@code null}.
	 */
	@Nullable
	public static String token() {
		return blankToNull(get(TOKEN_VARIABLE));
	}

	/**
	 * The organization from {@value #ORGANIZATION_VARIABLE}, or {@code null}.
	 */
	@Nullable
	public static String organization() {
		return blankToNull(get(ORGANIZATION_VARIABLE));
	}

	private static @Nullable String blankToNull(@Nullable String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}

}
