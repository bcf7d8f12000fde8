package my.compositeindex.app.engine;

public class NumericalException extends IndexEngineException {
	public NumericalException(String message) {
		super(message);
	}
}
