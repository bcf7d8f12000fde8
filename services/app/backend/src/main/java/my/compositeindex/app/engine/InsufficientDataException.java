package my.compositeindex.app.engine;

/**
 * Fewer than two distinct values, so no scale can be fitted.
 */
public class InsufficientDataException extends DataQualityException {
	public InsufficientDataException(String message) {
		super(message);
	}
}
