package my.compositeindex.app.engine;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A trained weighting scheme. Immutable: retraining produces a new model with a new id.
 * <p>
 * {@code indicators} freezes each indicator's direction and dimension at training time so that
 * later catalog edits cannot change how this model scores data.
 */
public record WeightModel(String id,
						  String name,
						  LocalDateTime createdAt,
						  WeightMethod method,
						  List<String> indicatorKeys,
						  List<IndicatorDefinition> indicators,
						  Map<String, Double> weights,
						  Map<String, Double> dimension2Weights,
						  StandardizationMethod standardizationMethod,
						  Map<String, StandardizationParams> standardizationParams,
						  ScoreScaling scoreScaling,
						  List<String> trainedOnDatasetIds,
						  MethodProvenance provenance) {
	public static final double SUM_TOLERANCE = 1e-9;

	public WeightModel {
		if (id == null || id.isBlank()) {
			throw new ValidationException("Weight model id is required");
		}
		if (method == null || standardizationMethod == null || provenance == null) {
			throw new ValidationException("Weight model method, standardization and provenance are required");
		}
		if (provenance.method() != method) {
			throw new ValidationException("Provenance " + provenance.method().value() + " does not match method " + method.value());
		}
		indicatorKeys = List.copyOf(indicatorKeys);
		indicators = List.copyOf(indicators);
		weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
		dimension2Weights = Collections.unmodifiableMap(new LinkedHashMap<>(dimension2Weights));
		standardizationParams = Collections.unmodifiableMap(new LinkedHashMap<>(standardizationParams));
		trainedOnDatasetIds = trainedOnDatasetIds == null ? List.of() : List.copyOf(trainedOnDatasetIds);

		if (indicators.size() != indicatorKeys.size()) {
			throw new ValidationException("Indicator snapshot does not match indicator keys");
		}
		for (int j = 0; j < indicatorKeys.size(); j++) {
			if (!indicatorKeys.get(j).equals(indicators.get(j).key())) {
				throw new ValidationException("Indicator snapshot out of order at position " + j);
			}
		}
		for (String key : weights.keySet()) {
			if (!indicatorKeys.contains(key)) {
				throw new ValidationException("Weight for unknown indicator " + key);
			}
		}
		for (String key : indicatorKeys) {
			StandardizationParams params = standardizationParams.get(key);
			if (params == null || params.method() != standardizationMethod) {
				throw new ValidationException("Missing or mismatched standardization parameters for " + key);
			}
		}
		requireUnitSum("weights", weights);
		requireUnitSum("dimension2Weights", dimension2Weights);
		if (standardizationMethod == StandardizationMethod.Z_SCORE && scoreScaling == null) {
			throw new ValidationException("Z-score models require score scaling");
		}
	}

	/**
	 * Same model under another id, e.g. for fixed sample ids.
	 */
	public WeightModel withId(String newId) {
		return new WeightModel(newId, name, createdAt, method, indicatorKeys, indicators, weights, dimension2Weights,
				standardizationMethod, standardizationParams, scoreScaling, trainedOnDatasetIds, provenance);
	}

	public double weight(String indicatorKey) {
		return weights.getOrDefault(indicatorKey, 0.0);
	}

	private static void requireUnitSum(String label, Map<String, Double> values) {
		double sum = 0.0;
		for (double v : values.values()) {
			if (v < 0.0 || !Double.isFinite(v)) {
				throw new ValidationException(label + " must be non-negative finite numbers");
			}
			sum += v;
		}
		if (Math.abs(sum - 1.0) >= SUM_TOLERANCE) {
			throw new ValidationException(label + " must sum to 1, got " + sum);
		}
	}
}
