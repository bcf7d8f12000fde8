package my.compositeindex.app.engine;

import my.compositeindex.app.engine.linalg.DominantEigenSolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analytic hierarchy process: the priority vector is the dominant eigenvector of the judgment
 * matrix, found by power iteration. Consistency is diagnosed, never enforced.
 */
public class AhpWeighter {
	public static final double DEFAULT_CONSISTENCY_THRESHOLD = 0.10;

	/**
	 * Saaty's random consistency index for n = 1..15; larger matrices reuse the last value.
	 */
	private static final double[] RANDOM_INDEX = {
			0.0, 0.0, 0.58, 0.90, 1.12, 1.24, 1.32, 1.41, 1.45, 1.49,
			1.51, 1.48, 1.56, 1.57, 1.59
	};

	private final DominantEigenSolver solver;
	private final double consistencyThreshold;

	public AhpWeighter() {
		this(new DominantEigenSolver(), DEFAULT_CONSISTENCY_THRESHOLD);
	}

	public AhpWeighter(DominantEigenSolver solver, double consistencyThreshold) {
		this.solver = solver;
		this.consistencyThreshold = consistencyThreshold;
	}

	public Weighting weigh(PairwiseComparisonMatrix matrix) {
		int n = matrix.size();
		DominantEigenSolver.DominantEigenpair eigenpair = solver.solve(matrix.toArray());
		double[] vector = eigenpair.vector();
		double sum = 0.0;
		for (double x : vector) {
			sum += x;
		}
		double[] weights = new double[n];
		Map<String, Double> priority = new LinkedHashMap<>();
		List<String> keys = matrix.indicatorKeys();
		for (int i = 0; i < n; i++) {
			weights[i] = vector[i] / sum;
			priority.put(keys.get(i), weights[i]);
		}

		double lambdaMax = eigenpair.value();
		double ci = n <= 2 ? 0.0 : Math.max(0.0, (lambdaMax - n) / (n - 1));
		double ri = randomIndex(n);
		double cr = ri == 0.0 ? 0.0 : ci / ri;
		MethodProvenance.Ahp provenance = new MethodProvenance.Ahp(matrix.toList(), priority, lambdaMax, ci, ri, cr,
				consistencyThreshold, cr < consistencyThreshold);
		return new Weighting(weights, provenance);
	}

	public double consistencyThreshold() {
		return consistencyThreshold;
	}

	public static double randomIndex(int n) {
		if (n < 1) {
			throw new ValidationException("AHP matrix size must be at least 1");
		}
		return RANDOM_INDEX[Math.min(n, RANDOM_INDEX.length) - 1];
	}
}
