package my.compositeindex.app.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ResultRow(String datasetId,
						String entity,
						int year,
						double scoreRaw,
						double index0100,
						Map<String, Double> subScoreRaw,
						Map<String, Double> subindex,
						Map<String, Double> rawValues) {
	public ResultRow {
		subScoreRaw = Collections.unmodifiableMap(new LinkedHashMap<>(subScoreRaw));
		subindex = Collections.unmodifiableMap(new LinkedHashMap<>(subindex));
		rawValues = Collections.unmodifiableMap(new LinkedHashMap<>(rawValues));
	}
}
