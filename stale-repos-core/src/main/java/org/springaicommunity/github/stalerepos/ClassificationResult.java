package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * One stale repository, as handed to the report writers.
 *
 * <p>
 * The shape is fixed: both supplemental fields are always present and serialize to
 * {@code null} when the metric was not requested, does not exist or failed to resolve.
 *
 * @param url repository web URL
 * @param daysInactive whole days since the last activity, in UTC
 * @param lastActiveDate UTC calendar date of the last activity
 * @param visibility public or private
 * @param daysSinceLastRelease days since the latest release
 * @param daysSinceLastPr days since the latest pull request
 */
@JsonPropertyOrder({ "url", "daysInactive", "lastPushDate", "visibility", "daysSinceLastRelease",
		"daysSinceLastPR" })
public record ClassificationResult(@JsonProperty("url") String url, @JsonProperty("daysInactive") int daysInactive,
		@JsonProperty("lastPushDate") LocalDate lastActiveDate, @JsonProperty("visibility") Visibility visibility,
		@JsonProperty("daysSinceLastRelease") SignalLookup<Integer> daysSinceLastRelease,
		@JsonProperty("daysSinceLastPR") SignalLookup<Integer> daysSinceLastPr) {

	/**
	 * Most inactive first, the order both reports use.
	 */
	public static final Comparator<ClassificationResult> BY_DAYS_INACTIVE_DESC = Comparator
		.comparingInt(ClassificationResult::daysInactive)
		.reversed();

}
