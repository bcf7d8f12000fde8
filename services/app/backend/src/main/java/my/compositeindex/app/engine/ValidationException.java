package my.compositeindex.app.engine;

/**
 * Malformed caller input: unknown indicator keys, bad matrices, out-of-range parameters.
 */
public class ValidationException extends IndexEngineException {
	public ValidationException(String message) {
		super(message);
	}
}
