package org.springaicommunity.github.mirror;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables, preferring a {@code .env} file in the working directory,
 * then the process environment, then a {@code .env} file in the user's home directory.
 * Both files are read once per process.
 */
public final class EnvironmentSupport {

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
	public static @Nullable String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Get an environment variable value, falling back to a default when it is unset or
	 * blank.
	 */
	public static String get(String name, String defaultValue) {
		String value = get(name);
		return (value == null || value.isBlank()) ? defaultValue : value.trim();
	}

	/**
	 * Get an integer environment variable.
	 * @throws IllegalStateException if the variable is set but not an integer
	 */
	public static int getInt(String name, int defaultValue) {
		String value = get(name);
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException(name + " must be an integer, got '" + value + "'");
		}
	}

}
