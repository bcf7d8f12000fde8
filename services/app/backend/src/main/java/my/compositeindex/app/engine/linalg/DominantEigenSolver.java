package my.compositeindex.app.engine.linalg;

import my.compositeindex.app.engine.NonConvergentEigenDecompositionException;
import my.compositeindex.app.engine.ValidationException;

import java.util.Arrays;

/**
 * Power iteration for the dominant eigenpair of a matrix with strictly positive entries.
 * The returned vector is normalized to sum to 1.
 */
public class DominantEigenSolver {
	public static final int DEFAULT_MAX_ITERATIONS = 1000;
	private static final double TOLERANCE = 1e-13;

	private final int maxIterations;

	public DominantEigenSolver() {
		this(DEFAULT_MAX_ITERATIONS);
	}

	public DominantEigenSolver(int maxIterations) {
		if (maxIterations < 1) {
			throw new IllegalArgumentException("maxIterations must be positive");
		}
		this.maxIterations = maxIterations;
	}

	public DominantEigenpair solve(double[][] matrix) {
		int n = matrix.length;
		for (double[] row : matrix) {
			if (row.length != n) {
				throw new ValidationException("Matrix must be square");
			}
			for (double x : row) {
				if (!(x > 0.0) || !Double.isFinite(x)) {
					throw new ValidationException("Power iteration requires strictly positive finite entries");
				}
			}
		}

		double[] vector = new double[n];
		Arrays.fill(vector, 1.0 / n);
		for (int iteration = 1; iteration <= maxIterations; iteration++) {
			double[] next = multiply(matrix, vector);
			double sum = 0.0;
			for (double x : next) {
				sum += x;
			}
			double delta = 0.0;
			for (int i = 0; i < n; i++) {
				next[i] /= sum;
				delta = Math.max(delta, Math.abs(next[i] - vector[i]));
			}
			vector = next;
			if (delta < TOLERANCE) {
				return new DominantEigenpair(eigenvalue(matrix, vector), vector, iteration);
			}
		}
		throw new NonConvergentEigenDecompositionException(
				"Power iteration did not converge after " + maxIterations + " iterations", maxIterations);
	}

	/**
	 * Rayleigh-style estimate: with the vector summing to 1, the sum of {@code Mv} equals lambda.
	 */
	private static double eigenvalue(double[][] matrix, double[] vector) {
		double lambda = 0.0;
		for (double x : multiply(matrix, vector)) {
			lambda += x;
		}
		return lambda;
	}

	private static double[] multiply(double[][] matrix, double[] vector) {
		int n = vector.length;
		double[] out = new double[n];
		for (int i = 0; i < n; i++) {
			double acc = 0.0;
			for (int j = 0; j < n; j++) {
				acc += matrix[i][j] * vector[j];
			}
			out[i] = acc;
		}
		return out;
	}

	public record DominantEigenpair(double value, double[] vector, int iterations) {
	}
}
