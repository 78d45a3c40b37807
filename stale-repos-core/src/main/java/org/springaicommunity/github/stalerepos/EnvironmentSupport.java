package org.springaicommunity.github.stalerepos;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.function.Function;

/**
 * Resolves configuration variables through dotenv-java. The {@code .env} files are loaded
 * once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable (dotenv-java gives it precedence)</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * Callers that must stay testable take a {@code Function<String, String>} lookup and
 * receive {@link #lookup()} in production.
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
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * The process-wide lookup, as a function.
	 */
	public static Function<String, @Nullable String> lookup() {
		return EnvironmentSupport::get;
	}

	/**
	 * Interpret a boolean flag value. Only a case-insensitive {@code true} (surrounding
	 * whitespace ignored) is true; a missing or blank value yields the default.
	 * @param value raw value, possibly null
	 * @param defaultValue value used when the variable is unset or blank
	 * @return parsed flag
	 */
	public static boolean parseBoolean(@Nullable String value, boolean defaultValue) {
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		return "true".equalsIgnoreCase(value.trim());
	}

}
