package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether higher raw values of an indicator are good or bad.
 */
public enum Direction {
	POSITIVE,
	NEGATIVE;

	/**
	 * Direction normalization: negative indicators are negated so that after standardization
	 * higher is always better.
	 */
	public double orient(double raw) {
		return this == NEGATIVE ? -raw : raw;
	}

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static Direction fromValue(String value) {
		if (value == null || value.isBlank()) {
			return POSITIVE;
		}
		try {
			return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new ValidationException("Unknown direction: " + value);
		}
	}
}
