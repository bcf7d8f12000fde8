package my.compositeindex.app.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DatasetSourceType {
	FILE,
	PASTE,
	MANUAL,
	SAMPLE;

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}
}
