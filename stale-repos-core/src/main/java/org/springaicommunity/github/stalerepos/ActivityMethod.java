package org.springaicommunity.github.stalerepos;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Which timestamp counts as a repository's last activity.
 */
public enum ActivityMethod {

	/**
	 * The repository's last push time, as reported by the listing endpoint.
	 */
	PUSHED("pushed", "have not had a push event"),

	/**
	 * Committer time of the commit at the tip of the default branch.
	 */
	DEFAULT_BRANCH_UPDATED("default_branch_updated", "have not had a commit on the default branch");

	private final String value;

	private final String reportPhrase;

	ActivityMethod(String value, String reportPhrase) {
		this.value = value;
		this.reportPhrase = reportPhrase;
	}

	public String value() {
		return value;
	}

	/**
	 * Predicate used in report headings, e.g. "have not had a push event".
	 */
	public String reportPhrase() {
		return reportPhrase;
	}

	/**
	 * Parse a configured activity method. Matching ignores case and treats {@code -} and
	 * {@code _} alike, so {@code default-branch-updated} is accepted.
	 * @param raw configured value
	 * @return the method
	 * @throws IllegalArgumentException for unsupported values
	 */
	public static ActivityMethod fromValue(String raw) {
		String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		for (ActivityMethod method : values()) {
			if (method.value.equals(normalized)) {
				return method;
			}
		}
		throw new IllegalArgumentException("ACTIVITY_METHOD environment variable has unsupported value: '" + raw
				+ "'. Allowed values are: "
				+ Arrays.stream(values()).map(ActivityMethod::value).collect(Collectors.joining(", ")));
	}

}
