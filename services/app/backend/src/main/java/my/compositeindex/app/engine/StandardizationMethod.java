package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StandardizationMethod {
	MIN_MAX("minmax"),
	Z_SCORE("zscore");

	private final String value;

	StandardizationMethod(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static StandardizationMethod fromValue(String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
		for (StandardizationMethod method : values()) {
			if (method.value.equals(normalized)) {
				return method;
			}
		}
		throw new ValidationException("Unknown standardization method: " + value);
	}
}
