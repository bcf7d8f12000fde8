package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WeightMethod {
	ENTROPY,
	PCA,
	AHP;

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	@JsonCreator
	public static WeightMethod fromValue(String value) {
		if (value == null || value.isBlank()) {
			throw new ValidationException("Weight method is required");
		}
		try {
			return WeightMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new ValidationException("Unknown weight method: " + value);
		}
	}
}
