package my.compositeindex.app.engine;

public class NonConvergentEigenDecompositionException extends NumericalException {
	private final int iterations;

	public NonConvergentEigenDecompositionException(String message, int iterations) {
		super(message);
		this.iterations = iterations;
	}

	public int getIterations() {
		return iterations;
	}
}
