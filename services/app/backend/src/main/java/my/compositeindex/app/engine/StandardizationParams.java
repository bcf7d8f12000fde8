package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Frozen per-indicator scale, fitted on direction-normalized training values.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = StandardizationParams.MinMax.class, name = "minmax"),
		@JsonSubTypes.Type(value = StandardizationParams.ZScore.class, name = "zscore")
})
public sealed interface StandardizationParams permits StandardizationParams.MinMax, StandardizationParams.ZScore {
	double MIN_MAX_NEUTRAL = 0.5;
	double Z_SCORE_NEUTRAL = 0.0;

	StandardizationMethod method();

	/**
	 * Maps an already direction-normalized value onto the fitted scale.
	 */
	double apply(double oriented);

	record MinMax(double min, double max) implements StandardizationParams {
		@Override
		public StandardizationMethod method() {
			return StandardizationMethod.MIN_MAX;
		}

		@Override
		public double apply(double oriented) {
			double range = max - min;
			if (range == 0.0) {
				return MIN_MAX_NEUTRAL;
			}
			double scaled = (oriented - min) / range;
			return Math.max(0.0, Math.min(1.0, scaled));
		}
	}

	record ZScore(double mean, double stddev) implements StandardizationParams {
		@Override
		public StandardizationMethod method() {
			return StandardizationMethod.Z_SCORE;
		}

		@Override
		public double apply(double oriented) {
			if (stddev == 0.0) {
				return Z_SCORE_NEUTRAL;
			}
			return (oriented - mean) / stddev;
		}
	}
}
