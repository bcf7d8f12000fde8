package my.compositeindex.app.service;

import my.compositeindex.app.engine.IndexAggregator;
import my.compositeindex.app.engine.ResultRow;
import my.compositeindex.app.engine.ResultSet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens result rows into the column layout recorded on the result set.
 */
public final class ResultTableWriter {
	private ResultTableWriter() {
	}

	public static List<Map<String, Object>> records(ResultSet result, int limit) {
		List<Map<String, Object>> records = new ArrayList<>();
		for (ResultRow row : result.rows()) {
			if (records.size() >= limit) {
				break;
			}
			records.add(record(result.columns(), row));
		}
		return records;
	}

	public static String csv(ResultSet result) {
		StringWriter out = new StringWriter();
		try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.withRecordSeparator('\n'))) {
			printer.printRecord(result.columns());
			for (ResultRow row : result.rows()) {
				printer.printRecord(record(result.columns(), row).values());
			}
		} catch (IOException exc) {
			throw new UncheckedIOException("Failed to write result CSV", exc);
		}
		return out.toString();
	}

	static Map<String, Object> record(List<String> columns, ResultRow row) {
		Map<String, Object> record = new LinkedHashMap<>();
		for (String column : columns) {
			record.put(column, value(column, row));
		}
		return record;
	}

	private static Object value(String column, ResultRow row) {
		switch (column) {
			case IndexAggregator.COLUMN_ENTITY:
				return row.entity();
			case IndexAggregator.COLUMN_YEAR:
				return row.year();
			case IndexAggregator.COLUMN_SCORE_RAW:
				return row.scoreRaw();
			case IndexAggregator.COLUMN_INDEX:
				return row.index0100();
			default:
				break;
		}
		for (String dimension : row.subScoreRaw().keySet()) {
			if (column.equals(IndexAggregator.subScoreColumn(dimension))) {
				return row.subScoreRaw().get(dimension);
			}
			if (column.equals(IndexAggregator.subindexColumn(dimension))) {
				return row.subindex().get(dimension);
			}
		}
		for (String key : row.rawValues().keySet()) {
			if (column.equals(IndexAggregator.rawColumn(key))) {
				return row.rawValues().get(key);
			}
		}
		return null;
	}
}
