package my.compositeindex.app.engine;

/**
 * Root of every failure raised by weight training and index computation.
 */
public abstract class IndexEngineException extends RuntimeException {
	protected IndexEngineException(String message) {
		super(message);
	}

	protected IndexEngineException(String message, Throwable cause) {
		super(message, cause);
	}
}
