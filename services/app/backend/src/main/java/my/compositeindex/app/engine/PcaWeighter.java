package my.compositeindex.app.engine;

import my.compositeindex.app.engine.linalg.EigenDecomposition;
import my.compositeindex.app.engine.linalg.SymmetricEigenSolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weights from principal-component loadings of a z-scored matrix.
 * <p>
 * The covariance of z-scores is the correlation matrix. The smallest number of components whose
 * cumulative explained variance reaches the threshold is retained, and indicator j receives
 * {@code sum_c |loading_jc| * lambda_c} over those components, renormalized to sum to 1.
 */
public class PcaWeighter {
	public static final double DEFAULT_CUMULATIVE_VARIANCE_THRESHOLD = 0.85;
	private static final double THRESHOLD_TOLERANCE = 1e-12;

	private final SymmetricEigenSolver solver;

	public PcaWeighter() {
		this(new SymmetricEigenSolver());
	}

	public PcaWeighter(SymmetricEigenSolver solver) {
		this.solver = solver;
	}

	public Weighting weigh(List<String> indicatorKeys, double[][] standardized, double threshold) {
		if (!(threshold > 0.0) || threshold > 1.0) {
			throw new ValidationException("Cumulative variance threshold must be in (0, 1], got " + threshold);
		}
		int n = standardized.length;
		int p = indicatorKeys.size();
		if (n <= p) {
			throw new InsufficientObservationsException(
					"PCA needs more observations than indicators (observations=" + n + ", indicators=" + p + ")");
		}

		EigenDecomposition decomposition = solver.decompose(covariance(standardized, p));
		double[] eigenvalues = new double[p];
		double total = 0.0;
		for (int c = 0; c < p; c++) {
			eigenvalues[c] = Math.max(0.0, decomposition.values()[c]);
			total += eigenvalues[c];
		}
		if (!(total > 0.0)) {
			throw new DegenerateIndicatorException(null, "PCA input has zero total variance");
		}

		List<Double> cumulative = new ArrayList<>(p);
		double running = 0.0;
		int retained = p;
		for (int c = 0; c < p; c++) {
			running += eigenvalues[c];
			double share = Math.min(1.0, running / total);
			cumulative.add(share);
			if (retained == p && share >= threshold - THRESHOLD_TOLERANCE) {
				retained = c + 1;
			}
		}

		double[] raw = new double[p];
		double rawTotal = 0.0;
		for (int j = 0; j < p; j++) {
			for (int c = 0; c < retained; c++) {
				raw[j] += Math.abs(decomposition.vector(c)[j]) * eigenvalues[c];
			}
			rawTotal += raw[j];
		}
		double[] weights = new double[p];
		Map<String, List<Double>> loadings = new LinkedHashMap<>();
		for (int j = 0; j < p; j++) {
			weights[j] = raw[j] / rawTotal;
			List<Double> row = new ArrayList<>(retained);
			for (int c = 0; c < retained; c++) {
				row.add(decomposition.vector(c)[j]);
			}
			loadings.put(indicatorKeys.get(j), row);
		}

		List<Double> eigenvalueList = new ArrayList<>(p);
		for (double value : eigenvalues) {
			eigenvalueList.add(value);
		}
		return new Weighting(weights,
				new MethodProvenance.Pca(threshold, retained, eigenvalueList, cumulative, loadings));
	}

	static double[][] covariance(double[][] x, int p) {
		int n = x.length;
		double[] mean = new double[p];
		for (double[] row : x) {
			for (int j = 0; j < p; j++) {
				mean[j] += row[j];
			}
		}
		for (int j = 0; j < p; j++) {
			mean[j] /= n;
		}
		double[][] cov = new double[p][p];
		for (double[] row : x) {
			for (int a = 0; a < p; a++) {
				double da = row[a] - mean[a];
				for (int b = a; b < p; b++) {
					cov[a][b] += da * (row[b] - mean[b]);
				}
			}
		}
		for (int a = 0; a < p; a++) {
			for (int b = a; b < p; b++) {
				cov[a][b] /= (n - 1);
				cov[b][a] = cov[a][b];
			}
		}
		return cov;
	}
}
