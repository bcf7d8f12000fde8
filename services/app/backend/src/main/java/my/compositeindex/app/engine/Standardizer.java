package my.compositeindex.app.engine;

import java.util.List;
import java.util.Map;

public final class Standardizer {
	private Standardizer() {
	}

	/**
	 * Fits scale parameters for one indicator over its training population.
	 *
	 * @param raw raw values, before direction normalization
	 * @throws MissingValueException if any value is NaN or infinite
	 * @throws InsufficientDataException if fewer than two distinct values exist
	 */
	public static StandardizationParams fit(StandardizationMethod method, String indicatorKey, Direction direction,
											double[] raw) {
		if (method == null) {
			throw new ValidationException("Standardization method is required");
		}
		if (raw == null || raw.length < 2) {
			throw new InsufficientDataException("Indicator " + indicatorKey + " needs at least 2 observations to fit a scale");
		}
		double[] oriented = new double[raw.length];
		boolean varies = false;
		for (int i = 0; i < raw.length; i++) {
			if (!Double.isFinite(raw[i])) {
				throw new MissingValueException("Indicator " + indicatorKey + " has a missing or non-numeric value at row " + i);
			}
			oriented[i] = direction.orient(raw[i]);
			if (oriented[i] != oriented[0]) {
				varies = true;
			}
		}
		if (!varies) {
			throw new DegenerateIndicatorException(indicatorKey,
					"Indicator " + indicatorKey + " is constant across the training population");
		}
		return switch (method) {
			case MIN_MAX -> fitMinMax(oriented);
			case Z_SCORE -> fitZScore(oriented);
		};
	}

	public static double apply(StandardizationParams params, Direction direction, double raw) {
		return params.apply(direction.orient(raw));
	}

	/**
	 * Standardizes observations column by column using frozen parameters.
	 */
	public static double[][] standardize(List<IndicatorDefinition> indicators,
										 Map<String, StandardizationParams> params,
										 List<Observation> observations) {
		double[][] matrix = new double[observations.size()][indicators.size()];
		for (int j = 0; j < indicators.size(); j++) {
			IndicatorDefinition indicator = indicators.get(j);
			StandardizationParams p = params.get(indicator.key());
			if (p == null) {
				throw new ValidationException("No standardization parameters for indicator " + indicator.key());
			}
			for (int i = 0; i < observations.size(); i++) {
				matrix[i][j] = apply(p, indicator.direction(), observations.get(i).value(j));
			}
		}
		return matrix;
	}

	private static StandardizationParams fitMinMax(double[] values) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double v : values) {
			min = Math.min(min, v);
			max = Math.max(max, v);
		}
		return new StandardizationParams.MinMax(min, max);
	}

	private static StandardizationParams fitZScore(double[] values) {
		double sum = 0.0;
		for (double v : values) {
			sum += v;
		}
		double mean = sum / values.length;
		double squares = 0.0;
		for (double v : values) {
			double d = v - mean;
			squares += d * d;
		}
		double stddev = Math.sqrt(squares / (values.length - 1));
		return new StandardizationParams.ZScore(mean, stddev);
	}
}
