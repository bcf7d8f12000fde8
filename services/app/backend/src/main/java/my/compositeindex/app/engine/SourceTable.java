package my.compositeindex.app.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A dataset as delivered by storage: declared columns plus rows of raw string cells.
 */
public record SourceTable(String datasetId, List<String> columns, List<Row> rows) {
	public SourceTable {
		columns = columns == null ? List.of() : List.copyOf(columns);
		rows = rows == null ? List.of() : List.copyOf(rows);
	}

	public boolean hasColumn(String column) {
		return column != null && columns.contains(column);
	}

	public record Row(String entity, int year, Map<String, String> cells) {
		public Row {
			cells = cells == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(cells));
		}

		public String cell(String column) {
			return cells.get(column);
		}
	}
}
