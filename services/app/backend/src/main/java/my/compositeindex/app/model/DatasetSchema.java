package my.compositeindex.app.model;

import java.util.List;
import java.util.Map;

/**
 * Inferred column types of an imported dataset. Types are {@code int}, {@code number} or {@code string}.
 */
public record DatasetSchema(List<String> columns,
							Map<String, String> types,
							int rowCount,
							List<String> required) {
	public static final String TYPE_INT = "int";
	public static final String TYPE_NUMBER = "number";
	public static final String TYPE_STRING = "string";
}
