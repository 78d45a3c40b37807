package org.springaicommunity.github.stalerepos;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Optional enrichments attached to a stale repository in the report.
 */
public enum SupplementalMetric {

	RELEASE("release"), PR("pr");

	private final String value;

	SupplementalMetric(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	public static SupplementalMetric fromValue(String raw) {
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		for (SupplementalMetric metric : values()) {
			if (metric.value.equals(normalized)) {
				return metric;
			}
		}
		throw new IllegalArgumentException(
				"Unsupported additional metric: '" + raw + "' (must be 'release' or 'pr')");
	}

	/**
	 * Parse a comma-separated list such as {@code "release,pr"}. Blank entries are
	 * ignored.
	 * @param csv comma-separated values
	 * @return the requested metrics, empty when none
	 */
	public static Set<SupplementalMetric> parseList(String csv) {
		Set<SupplementalMetric> metrics = EnumSet.noneOf(SupplementalMetric.class);
		for (String part : csv.split(",")) {
			if (!part.isBlank()) {
				metrics.add(fromValue(part));
			}
		}
		return metrics;
	}

}
