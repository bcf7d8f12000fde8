package my.compositeindex.app.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a stored table plus its column mapping into numeric observations for a fixed, ordered
 * set of indicators.
 */
public final class ObservationResolver {
	private final List<String> indicatorKeys;

	public ObservationResolver(List<String> indicatorKeys) {
		if (indicatorKeys == null || indicatorKeys.isEmpty()) {
			throw new ValidationException("At least one indicator is required");
		}
		this.indicatorKeys = List.copyOf(indicatorKeys);
	}

	public List<String> indicatorKeys() {
		return indicatorKeys;
	}

	/**
	 * Resolves every row, collecting failures instead of throwing.
	 */
	public Resolution resolve(SourceTable table, ColumnMapping mapping) {
		String[] columns = new String[indicatorKeys.size()];
		List<String> unmapped = new ArrayList<>();
		for (int j = 0; j < indicatorKeys.size(); j++) {
			String key = indicatorKeys.get(j);
			String column = mapping == null ? null : mapping.columnFor(key);
			if (column == null || !table.hasColumn(column)) {
				unmapped.add(key);
			}
			columns[j] = column;
		}

		List<Observation> observations = new ArrayList<>();
		List<RowFailure> failures = new ArrayList<>();
		for (SourceTable.Row row : table.rows()) {
			if (!unmapped.isEmpty()) {
				failures.add(new RowFailure(table.datasetId(), row.entity(), row.year(), unmapped.get(0),
						FailureCause.MISSING_MAPPING, describeUnmapped(table, mapping, unmapped)));
				continue;
			}
			double[] values = new double[indicatorKeys.size()];
			RowFailure failure = null;
			for (int j = 0; j < indicatorKeys.size() && failure == null; j++) {
				String raw = row.cell(columns[j]);
				Double parsed = parse(raw);
				if (parsed == null) {
					String reason = raw == null || raw.isBlank() ? "missing value" : "non-numeric value '" + raw.trim() + "'";
					failure = new RowFailure(table.datasetId(), row.entity(), row.year(), indicatorKeys.get(j),
							FailureCause.MISSING_VALUE,
							String.format(Locale.ROOT, "%s for %s-%d in column %s (indicator %s)",
									reason, row.entity(), row.year(), columns[j], indicatorKeys.get(j)));
				} else {
					values[j] = parsed;
				}
			}
			if (failure != null) {
				failures.add(failure);
			} else {
				observations.add(new Observation(table.datasetId(), row.entity(), row.year(), values));
			}
		}
		return new Resolution(observations, failures);
	}

	/**
	 * Resolves every row, failing on the first problem. Used for training populations, which must be complete.
	 */
	public List<Observation> resolveStrict(SourceTable table, ColumnMapping mapping) {
		Resolution resolution = resolve(table, mapping);
		if (!resolution.failures().isEmpty()) {
			RowFailure first = resolution.failures().get(0);
			String message = "Dataset " + table.datasetId() + ": " + first.message();
			if (first.cause() == FailureCause.MISSING_MAPPING) {
				throw new MissingMappingException(message);
			}
			throw new MissingValueException(message);
		}
		return resolution.observations();
	}

	static Double parse(String raw) {
		if (raw == null) {
			return null;
		}
		String trimmed = raw.trim();
		if (trimmed.isEmpty()) {
			return null;
		}
		try {
			double value = Double.parseDouble(trimmed);
			return Double.isFinite(value) ? value : null;
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	private String describeUnmapped(SourceTable table, ColumnMapping mapping, List<String> unmapped) {
		List<String> parts = new ArrayList<>();
		for (String key : unmapped) {
			String column = mapping == null ? null : mapping.columnFor(key);
			parts.add(column == null
					? "indicator " + key + " is not mapped"
					: "column " + column + " (indicator " + key + ") not found");
		}
		return String.join("; ", parts);
	}

	public record Resolution(List<Observation> observations, List<RowFailure> failures) {
	}
}
