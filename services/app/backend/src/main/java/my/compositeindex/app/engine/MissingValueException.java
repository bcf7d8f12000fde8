package my.compositeindex.app.engine;

public class MissingValueException extends DataQualityException {
	public MissingValueException(String message) {
		super(message);
	}
}
