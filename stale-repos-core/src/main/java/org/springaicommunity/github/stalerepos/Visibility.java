package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Repository visibility as shown in reports.
 */
public enum Visibility {

	PUBLIC, PRIVATE;

	/**
	 * Map the provider's {@code private} flag. A missing flag maps to {@link #PRIVATE}.
	 * @param isPrivate provider flag, or null when absent
	 * @return visibility
	 */
	public static Visibility fromPrivateFlag(@Nullable Boolean isPrivate) {
		return Boolean.FALSE.equals(isPrivate) ? PUBLIC : PRIVATE;
	}

	@JsonValue
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return label();
	}

}
