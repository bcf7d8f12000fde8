package my.compositeindex.app.engine;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Output of one aggregation run: scored rows plus the rows that had to be skipped.
 */
public record ResultSet(String id,
						String name,
						LocalDateTime createdAt,
						List<String> datasetIds,
						String weightModelId,
						List<String> columns,
						List<ResultRow> rows,
						List<RowFailure> failures) {
	public ResultSet {
		datasetIds = List.copyOf(datasetIds);
		columns = List.copyOf(columns);
		rows = List.copyOf(rows);
		failures = List.copyOf(failures);
	}

	public ResultSet withId(String newId) {
		return new ResultSet(newId, name, createdAt, datasetIds, weightModelId, columns, rows, failures);
	}

	public int rowCount() {
		return rows.size();
	}

	public int failedRowCount() {
		return failures.size();
	}
}
