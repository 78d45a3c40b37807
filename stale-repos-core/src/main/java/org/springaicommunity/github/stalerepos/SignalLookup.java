package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one per-repository signal (activity time, a supplemental metric).
 *
 * <p>
 * Keeps "nothing to report" apart from "could not find out": {@link Status#ABSENT} means
 * the provider answered and there is no value (no releases yet), {@link Status#FAILED}
 * means the lookup broke in a known, recoverable way. Reports render every status except
 * {@link Status#FOUND} as the same absent marker.
 *
 * @param <T> value type
 * @param status lookup outcome
 * @param value the value, non-null exactly when status is {@link Status#FOUND}
 * @param reason why a FAILED lookup failed
 */
public record SignalLookup<T>(Status status, @Nullable T value, @Nullable String reason) {

	public enum Status {

		FOUND, ABSENT, NOT_REQUESTED, FAILED

	}

	public SignalLookup {
		Objects.requireNonNull(status, "status");
		if ((status == Status.FOUND) != (value != null)) {
			throw new IllegalArgumentException("A value is required for FOUND and forbidden otherwise");
		}
	}

	public static <T> SignalLookup<T> found(T value) {
		return new SignalLookup<>(Status.FOUND, value, null);
	}

	public static <T> SignalLookup<T> absent() {
		return new SignalLookup<>(Status.ABSENT, null, null);
	}

	public static <T> SignalLookup<T> notRequested() {
		return new SignalLookup<>(Status.NOT_REQUESTED, null, null);
	}

	public static <T> SignalLookup<T> failed(String reason) {
		return new SignalLookup<>(Status.FAILED, null, reason);
	}

	public boolean isFound() {
		return status == Status.FOUND;
	}

	public Optional<T> asOptional() {
		return Optional.ofNullable(value);
	}

	/**
	 * JSON form: the value itself, or {@code null} for every non-FOUND status.
	 */
	@JsonValue
	@Nullable
	public T jsonValue() {
		return value;
	}

}
