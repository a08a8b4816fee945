package org.springaicommunity.stargazers.fetch;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves settings such as {@code GITHUB_TOKEN} from the environment. A {@code .env}
 * file in the working directory and one in the user's home directory are loaded once
 * per process; the system environment takes precedence over both.
 */
public final class EnvironmentSupport {

	/**
	 * Variable holding the GitHub access token.
	 */
	public static final String TOKEN_VARIABLE = "GITHUB_TOKEN";

	/**
	 * Variable holding the response cache root directory.
	 */
	public static final String CACHE_DIR_VARIABLE = "STARGAZERS_CACHE_DIR";

	private static final Dotenv WORKING_DIR_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	@Nullable
	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	@Nullable
	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	private EnvironmentSupport() {
	}

	/**
	 * Look up a variable.
	 * @param name the variable name
	 * @return the value, or {@code null} if it is not defined anywhere
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR_DOTENV.get(name);
		if (value == null && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Look up a variable, falling back to {@code defaultValue} when it is undefined or
	 * blank.
	 * @param name the variable name
	 * @param defaultValue value returned when the variable is not set
	 * @return the resolved value
	 */
	public static String getOrDefault(String name, String defaultValue) {
		String value = get(name);
		return (value == null || value.isBlank()) ? defaultValue : value;
	}

}
