package my.compositeindex.app.importer;

import my.compositeindex.app.model.DatasetSchema;
import my.compositeindex.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses entity x year CSV data and normalizes it: trimmed cells, a mandatory {@code entity}
 * column, integer years (optionally filled from an override) and unique entity/year pairs.
 */
public class DatasetCsvParser {
	public static final String ENTITY_COLUMN = "entity";
	public static final String YEAR_COLUMN = "year";
	private static final int MAX_DUPLICATE_EXAMPLES = 5;

	public ParsedDataset parse(String text, Integer yearOverride) {
		String content = CsvParsing.stripBom(text == null ? "" : text).strip();
		if (content.isEmpty()) {
			throw new DatasetImportException("CSV is empty");
		}
		char delimiter = CsvParsing.sniffDelimiter(CsvParsing.headerLine(content));

		List<String> columns = new ArrayList<>();
		List<Map<String, String>> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader().withAllowMissingColumnNames().withTrim()
		)) {
			Set<String> seen = new HashSet<>();
			for (String header : parser.getHeaderNames()) {
				String column = CsvParsing.trimToEmpty(header);
				if (column.isEmpty()) {
					continue;
				}
				if (!seen.add(column)) {
					throw new DatasetImportException("Duplicate column in CSV header: " + column);
				}
				columns.add(column);
			}
			for (CSVRecord record : parser) {
				Map<String, String> row = new LinkedHashMap<>();
				for (String column : columns) {
					row.put(column, record.isSet(column) ? CsvParsing.trimToEmpty(record.get(column)) : "");
				}
				rows.add(row);
			}
		} catch (IOException | IllegalStateException exc) {
			throw new DatasetImportException("Failed to read CSV: " + exc.getMessage(), exc);
		}
		if (columns.isEmpty()) {
			throw new DatasetImportException("CSV header is missing");
		}
		return normalize(columns, rows, yearOverride);
	}

	/**
	 * Applies the import rules to an already tabular payload, e.g. edited rows sent back by a client.
	 */
	public ParsedDataset normalize(List<String> columns, List<Map<String, String>> rows, Integer yearOverride) {
		List<String> normalizedColumns = new ArrayList<>(new LinkedHashSet<>(columns.stream()
				.map(CsvParsing::trimToEmpty)
				.filter(column -> !column.isEmpty())
				.toList()));
		if (!normalizedColumns.contains(ENTITY_COLUMN)) {
			throw new DatasetImportException("CSV must contain an 'entity' column");
		}
		boolean hasYear = normalizedColumns.contains(YEAR_COLUMN);
		if (!hasYear) {
			if (yearOverride == null) {
				throw new DatasetImportException("CSV has no 'year' column; provide a year for the import");
			}
			List<String> reordered = new ArrayList<>(List.of(ENTITY_COLUMN, YEAR_COLUMN));
			normalizedColumns.stream().filter(column -> !ENTITY_COLUMN.equals(column)).forEach(reordered::add);
			normalizedColumns = reordered;
		}

		List<Map<String, String>> normalizedRows = new ArrayList<>();
		int line = 1;
		for (Map<String, String> source : rows) {
			line++;
			Map<String, String> row = new LinkedHashMap<>();
			for (String column : normalizedColumns) {
				row.put(column, CsvParsing.trimToEmpty(source == null ? null : source.get(column)));
			}
			if (row.get(ENTITY_COLUMN).isEmpty()) {
				throw new DatasetImportException("Row " + line + " has an empty entity");
			}
			row.put(YEAR_COLUMN, normalizeYear(row.get(YEAR_COLUMN), yearOverride, line));
			normalizedRows.add(row);
		}
		requireUniqueEntityYear(normalizedRows);
		return new ParsedDataset(List.copyOf(normalizedColumns), normalizedRows, inferSchema(normalizedColumns, normalizedRows));
	}

	DatasetSchema inferSchema(List<String> columns, List<Map<String, String>> rows) {
		Map<String, String> types = new LinkedHashMap<>();
		for (String column : columns) {
			List<String> values = rows.stream()
					.map(row -> row.getOrDefault(column, ""))
					.filter(value -> !value.isBlank())
					.toList();
			if (values.isEmpty()) {
				types.put(column, DatasetSchema.TYPE_STRING);
			} else if (YEAR_COLUMN.equals(column)) {
				types.put(column, values.stream().allMatch(value -> parseInteger(value) != null)
						? DatasetSchema.TYPE_INT
						: DatasetSchema.TYPE_STRING);
			} else {
				types.put(column, values.stream().allMatch(DatasetCsvParser::isNumeric)
						? DatasetSchema.TYPE_NUMBER
						: DatasetSchema.TYPE_STRING);
			}
		}
		return new DatasetSchema(List.copyOf(columns), types, rows.size(), List.of(ENTITY_COLUMN, YEAR_COLUMN));
	}

	private String normalizeYear(String raw, Integer yearOverride, int line) {
		if (raw == null || raw.isBlank()) {
			if (yearOverride == null) {
				throw new DatasetImportException("Row " + line + " has an empty year");
			}
			return Integer.toString(yearOverride);
		}
		Integer year = parseInteger(raw);
		if (year == null) {
			throw new DatasetImportException("Row " + line + " has a non-numeric year: " + raw);
		}
		return Integer.toString(year);
	}

	private void requireUniqueEntityYear(List<Map<String, String>> rows) {
		Set<String> seen = new HashSet<>();
		Set<String> duplicates = new LinkedHashSet<>();
		for (Map<String, String> row : rows) {
			String key = "(" + row.get(ENTITY_COLUMN) + "," + row.get(YEAR_COLUMN) + ")";
			if (!seen.add(key)) {
				duplicates.add(key);
			}
		}
		if (!duplicates.isEmpty()) {
			List<String> examples = duplicates.stream().limit(MAX_DUPLICATE_EXAMPLES).toList();
			throw new DatasetImportException("Duplicate entity/year pairs, e.g. " + String.join(", ", examples));
		}
	}

	/**
	 * Accepts integral values written as decimals, so {@code 2020.0} becomes 2020.
	 */
	static Integer parseInteger(String raw) {
		try {
			BigDecimal value = new BigDecimal(raw.trim());
			return value.setScale(0, RoundingMode.DOWN).intValueExact();
		} catch (NumberFormatException | ArithmeticException exc) {
			return null;
		}
	}

	private static boolean isNumeric(String raw) {
		try {
			return Double.isFinite(Double.parseDouble(raw.trim()));
		} catch (NumberFormatException exc) {
			return false;
		}
	}
}
