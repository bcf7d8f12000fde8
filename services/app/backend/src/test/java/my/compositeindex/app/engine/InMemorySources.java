package my.compositeindex.app.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Datasets, mappings and catalog held in maps, for driving the engine without storage.
 */
class InMemorySources implements DatasetReader, IndicatorCatalog {
	private final Map<String, SourceTable> tables = new HashMap<>();
	private final Map<String, ColumnMapping> mappings = new HashMap<>();
	private final Map<String, IndicatorDefinition> indicators = new HashMap<>();

	InMemorySources indicator(String key, String dimension, Direction direction) {
		indicators.put(key, new IndicatorDefinition(key, dimension, direction));
		return this;
	}

	/**
	 * Rows are {@code entity, year, cell...} in the order of {@code valueColumns}.
	 */
	InMemorySources dataset(String datasetId, List<String> valueColumns, Object[]... rows) {
		List<String> columns = new ArrayList<>(List.of("entity", "year"));
		columns.addAll(valueColumns);
		List<SourceTable.Row> tableRows = new ArrayList<>();
		for (Object[] row : rows) {
			Map<String, String> cells = new LinkedHashMap<>();
			cells.put("entity", (String) row[0]);
			cells.put("year", String.valueOf(row[1]));
			for (int i = 0; i < valueColumns.size(); i++) {
				Object value = row[i + 2];
				cells.put(valueColumns.get(i), value == null ? null : String.valueOf(value));
			}
			tableRows.add(new SourceTable.Row((String) row[0], (Integer) row[1], cells));
		}
		tables.put(datasetId, new SourceTable(datasetId, columns, tableRows));
		return this;
	}

	InMemorySources mapping(String datasetId, Map<String, String> columnsByIndicator) {
		mappings.put(datasetId, new ColumnMapping(datasetId, columnsByIndicator));
		return this;
	}

	SourceTable table(String datasetId) {
		return tables.get(datasetId);
	}

	@Override
	public SourceTable read(String datasetId) {
		SourceTable table = tables.get(datasetId);
		if (table == null) {
			throw new ValidationException("Unknown dataset " + datasetId);
		}
		return table;
	}

	@Override
	public Optional<IndicatorDefinition> find(String key) {
		return Optional.ofNullable(indicators.get(key));
	}

	ColumnMapping mappingFor(String datasetId) {
		return mappings.get(datasetId);
	}

	MappingReader mappingReader() {
		return this::mappingFor;
	}

	static Object[] row(Object... cells) {
		return cells;
	}
}
