package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FailureCause {
	MISSING_MAPPING,
	MISSING_VALUE,
	DUPLICATE_KEY;

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}
}
