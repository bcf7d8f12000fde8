package my.compositeindex.app.engine.linalg;

/**
 * Eigenvalues in descending order; {@code vectors[c]} is the unit eigenvector of {@code values[c]}.
 */
public record EigenDecomposition(double[] values, double[][] vectors, int sweeps) {
	public int size() {
		return values.length;
	}

	public double[] vector(int component) {
		return vectors[component];
	}
}
