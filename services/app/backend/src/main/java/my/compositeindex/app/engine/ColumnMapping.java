package my.compositeindex.app.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Collections;

/**
 * Indicator key to source column name, for one dataset.
 */
public record ColumnMapping(String datasetId, Map<String, String> columnsByIndicator) {
	public ColumnMapping {
		columnsByIndicator = columnsByIndicator == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(columnsByIndicator));
	}

	public String columnFor(String indicatorKey) {
		String column = columnsByIndicator.get(indicatorKey);
		return column == null || column.isBlank() ? null : column;
	}
}
