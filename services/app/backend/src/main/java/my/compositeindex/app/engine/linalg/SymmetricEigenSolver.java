package my.compositeindex.app.engine.linalg;

import my.compositeindex.app.engine.NonConvergentEigenDecompositionException;
import my.compositeindex.app.engine.ValidationException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Cyclic Jacobi eigenvalue method for small dense symmetric matrices.
 * <p>
 * Each eigenvector is sign-fixed so that its entry of largest magnitude is positive (the first
 * such entry on ties), which makes the decomposition reproducible.
 */
public class SymmetricEigenSolver {
	public static final int DEFAULT_MAX_SWEEPS = 100;
	private static final double TOLERANCE = 1e-12;

	private final int maxSweeps;

	public SymmetricEigenSolver() {
		this(DEFAULT_MAX_SWEEPS);
	}

	public SymmetricEigenSolver(int maxSweeps) {
		if (maxSweeps < 1) {
			throw new IllegalArgumentException("maxSweeps must be positive");
		}
		this.maxSweeps = maxSweeps;
	}

	public EigenDecomposition decompose(double[][] matrix) {
		int n = validate(matrix);
		double[][] a = new double[n][];
		for (int i = 0; i < n; i++) {
			a[i] = matrix[i].clone();
		}
		double[][] v = new double[n][n];
		for (int i = 0; i < n; i++) {
			v[i][i] = 1.0;
		}

		double scale = Math.max(1.0, frobenius(a));
		int sweep = 0;
		while (offDiagonal(a) > TOLERANCE * scale) {
			if (sweep >= maxSweeps) {
				throw new NonConvergentEigenDecompositionException(
						"Jacobi eigen-decomposition did not converge after " + maxSweeps + " sweeps", sweep);
			}
			for (int p = 0; p < n - 1; p++) {
				for (int q = p + 1; q < n; q++) {
					if (a[p][q] != 0.0) {
						rotate(a, v, p, q);
					}
				}
			}
			sweep++;
		}

		double[] diagonal = new double[n];
		for (int i = 0; i < n; i++) {
			diagonal[i] = a[i][i];
		}
		Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
		Arrays.sort(order, Comparator.comparingDouble((Integer i) -> diagonal[i]).reversed());

		double[] values = new double[n];
		double[][] vectors = new double[n][n];
		for (int c = 0; c < n; c++) {
			int source = order[c];
			values[c] = diagonal[source];
			for (int k = 0; k < n; k++) {
				vectors[c][k] = v[k][source];
			}
			fixSign(vectors[c]);
		}
		return new EigenDecomposition(values, vectors, sweep);
	}

	static void fixSign(double[] vector) {
		int largest = 0;
		for (int k = 1; k < vector.length; k++) {
			if (Math.abs(vector[k]) > Math.abs(vector[largest])) {
				largest = k;
			}
		}
		if (vector[largest] < 0.0) {
			for (int k = 0; k < vector.length; k++) {
				vector[k] = -vector[k];
			}
		}
	}

	private void rotate(double[][] a, double[][] v, int p, int q) {
		int n = a.length;
		double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
		double t = Math.signum(theta) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
		if (theta == 0.0) {
			t = 1.0;
		}
		double c = 1.0 / Math.sqrt(t * t + 1.0);
		double s = t * c;
		for (int k = 0; k < n; k++) {
			double akp = a[k][p];
			double akq = a[k][q];
			a[k][p] = c * akp - s * akq;
			a[k][q] = s * akp + c * akq;
		}
		for (int k = 0; k < n; k++) {
			double apk = a[p][k];
			double aqk = a[q][k];
			a[p][k] = c * apk - s * aqk;
			a[q][k] = s * apk + c * aqk;
		}
		for (int k = 0; k < n; k++) {
			double vkp = v[k][p];
			double vkq = v[k][q];
			v[k][p] = c * vkp - s * vkq;
			v[k][q] = s * vkp + c * vkq;
		}
	}

	private int validate(double[][] matrix) {
		if (matrix == null || matrix.length == 0) {
			throw new ValidationException("Matrix must not be empty");
		}
		int n = matrix.length;
		for (int i = 0; i < n; i++) {
			if (matrix[i] == null || matrix[i].length != n) {
				throw new ValidationException("Matrix must be square");
			}
			for (int j = 0; j < n; j++) {
				if (!Double.isFinite(matrix[i][j])) {
					throw new ValidationException("Matrix contains a non-finite entry at (" + i + "," + j + ")");
				}
				if (j > i && Math.abs(matrix[i][j] - matrix[j][i]) > 1e-9 * Math.max(1.0, Math.abs(matrix[i][j]))) {
					throw new ValidationException("Matrix must be symmetric");
				}
			}
		}
		return n;
	}

	private static double offDiagonal(double[][] a) {
		double sum = 0.0;
		for (int i = 0; i < a.length; i++) {
			for (int j = 0; j < a.length; j++) {
				if (i != j) {
					sum += a[i][j] * a[i][j];
				}
			}
		}
		return Math.sqrt(sum);
	}

	private static double frobenius(double[][] a) {
		double sum = 0.0;
		for (double[] row : a) {
			for (double x : row) {
				sum += x * x;
			}
		}
		return Math.sqrt(sum);
	}
}
