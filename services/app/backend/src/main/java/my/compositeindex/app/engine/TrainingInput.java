package my.compositeindex.app.engine;

import java.util.List;

/**
 * A complete training population: indicators in model order and observations whose values follow that order.
 */
public record TrainingInput(String name,
							List<IndicatorDefinition> indicators,
							List<Observation> observations,
							List<String> datasetIds) {
	public TrainingInput {
		indicators = List.copyOf(indicators);
		observations = List.copyOf(observations);
		datasetIds = datasetIds == null ? List.of() : List.copyOf(datasetIds);
		if (indicators.isEmpty()) {
			throw new ValidationException("At least one indicator is required");
		}
	}

	public List<String> indicatorKeys() {
		return indicators.stream().map(IndicatorDefinition::key).toList();
	}
}
