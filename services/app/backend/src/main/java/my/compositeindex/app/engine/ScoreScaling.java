package my.compositeindex.app.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Training-population range of the raw composite and dimension scores. Z-score models map
 * through it onto 0..100, since their raw scores are unbounded.
 */
public record ScoreScaling(double scoreMin,
						   double scoreMax,
						   Map<String, Double> subScoreMin,
						   Map<String, Double> subScoreMax) {
	static final double NEUTRAL_INDEX = 50.0;

	public ScoreScaling {
		subScoreMin = Collections.unmodifiableMap(new LinkedHashMap<>(subScoreMin));
		subScoreMax = Collections.unmodifiableMap(new LinkedHashMap<>(subScoreMax));
	}

	public double scaleComposite(double raw) {
		return toIndex(raw, scoreMin, scoreMax);
	}

	public double scaleDimension(String dimension, double raw) {
		Double min = subScoreMin.get(dimension);
		Double max = subScoreMax.get(dimension);
		if (min == null || max == null) {
			return NEUTRAL_INDEX;
		}
		return toIndex(raw, min, max);
	}

	static double toIndex(double raw, double min, double max) {
		double range = max - min;
		if (range == 0.0) {
			return NEUTRAL_INDEX;
		}
		return clampIndex(100.0 * (raw - min) / range);
	}

	static double clampIndex(double value) {
		return Math.max(0.0, Math.min(100.0, value));
	}
}
