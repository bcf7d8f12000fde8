package my.compositeindex.app.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entropy weight method over a min-max standardized matrix.
 */
public class EntropyWeighter {

	public Weighting weigh(List<String> indicatorKeys, double[][] standardized) {
		int n = standardized.length;
		int p = indicatorKeys.size();
		if (n < 2) {
			throw new InsufficientObservationsException("Entropy weighting needs at least 2 observations, got " + n);
		}
		double k = 1.0 / Math.log(n);

		double[] entropy = new double[p];
		double[] divergence = new double[p];
		double divergenceTotal = 0.0;
		for (int j = 0; j < p; j++) {
			String key = indicatorKeys.get(j);
			double columnSum = 0.0;
			double first = standardized[0][j];
			boolean constant = true;
			for (double[] row : standardized) {
				double x = row[j];
				if (x < 0.0 || !Double.isFinite(x)) {
					throw new ValidationException("Entropy weighting requires values in [0,1]; indicator " + key + " has " + x);
				}
				columnSum += x;
				constant &= x == first;
			}
			if (columnSum == 0.0 || constant) {
				throw new DegenerateIndicatorException(key,
						"Indicator " + key + " is uniform across all observations and carries no information");
			}
			double acc = 0.0;
			for (double[] row : standardized) {
				double pij = row[j] / columnSum;
				if (pij > 0.0) {
					acc += pij * Math.log(pij);
				}
			}
			entropy[j] = -k * acc;
			divergence[j] = 1.0 - entropy[j];
			divergenceTotal += divergence[j];
		}
		if (!(divergenceTotal > 0.0)) {
			throw new AllIndicatorsUniformException("No indicator carries discriminative information (all divergences are 0)");
		}

		double[] weights = new double[p];
		Map<String, Double> entropyByKey = new LinkedHashMap<>();
		Map<String, Double> divergenceByKey = new LinkedHashMap<>();
		for (int j = 0; j < p; j++) {
			weights[j] = divergence[j] / divergenceTotal;
			entropyByKey.put(indicatorKeys.get(j), entropy[j]);
			divergenceByKey.put(indicatorKeys.get(j), divergence[j]);
		}
		return new Weighting(weights, new MethodProvenance.Entropy(entropyByKey, divergenceByKey));
	}
}
