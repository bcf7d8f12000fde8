package my.compositeindex.app.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted sums over one standardized row: the composite score and, per dimension, the
 * dimension-renormalized score. Dimensions with zero total weight are left out.
 */
final class CompositeScorer {
	private final List<IndicatorDefinition> indicators;
	private final double[] weights;
	private final Map<String, Double> dimensionWeights;

	CompositeScorer(List<IndicatorDefinition> indicators, double[] weights, Map<String, Double> dimensionWeights) {
		this.indicators = indicators;
		this.weights = weights;
		this.dimensionWeights = dimensionWeights;
	}

	static Map<String, Double> dimensionWeights(List<IndicatorDefinition> indicators, double[] weights) {
		Map<String, Double> byDimension = new LinkedHashMap<>();
		for (int j = 0; j < indicators.size(); j++) {
			byDimension.merge(indicators.get(j).dimension2Key(), weights[j], Double::sum);
		}
		return byDimension;
	}

	RawScores score(double[] standardized) {
		double composite = 0.0;
		Map<String, Double> accumulated = new LinkedHashMap<>();
		for (int j = 0; j < indicators.size(); j++) {
			double contribution = weights[j] * standardized[j];
			composite += contribution;
			accumulated.merge(indicators.get(j).dimension2Key(), contribution, Double::sum);
		}
		Map<String, Double> byDimension = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : accumulated.entrySet()) {
			double dimensionWeight = dimensionWeights.getOrDefault(entry.getKey(), 0.0);
			if (dimensionWeight > 0.0) {
				byDimension.put(entry.getKey(), entry.getValue() / dimensionWeight);
			}
		}
		return new RawScores(composite, byDimension);
	}

	record RawScores(double composite, Map<String, Double> byDimension) {
	}
}
