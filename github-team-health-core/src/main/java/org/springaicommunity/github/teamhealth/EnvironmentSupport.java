package org.springaicommunity.github.teamhealth;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves settings such as {@code GITHUB_TOKEN} from {@code .env} files and the process
 * environment. Files are read once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} in the working directory, then the system environment</li>
 * <li>{@code .env} in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final @Nullable Dotenv HOME_DOTENV = loadHomeDotenv();

	private EnvironmentSupport() {
	}

	private static @Nullable Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	public static @Nullable String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Returns the first non-blank of {@code configured} and the resolved variable.
	 * @param configured an explicitly configured value, may be null or blank
	 * @param name the variable to fall back to
	 * @return the value
	 * @throws IllegalStateException if neither is set
	 */
	public static String require(@Nullable String configured, String name) {
		if (configured != null && !configured.isBlank()) {
			return configured;
		}
		String value = get(name);
		if (value == null || value.isBlank()) {
			throw new IllegalStateException(name + " is not set. Export it or add it to a .env file.");
		}
		return value;
	}

}
