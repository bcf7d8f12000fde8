package my.compositeindex.app.engine;

/**
 * The data itself cannot support the requested computation.
 */
public class DataQualityException extends IndexEngineException {
	public DataQualityException(String message) {
		super(message);
	}
}
