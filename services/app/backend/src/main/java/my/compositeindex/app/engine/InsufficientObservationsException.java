package my.compositeindex.app.engine;

public class InsufficientObservationsException extends DataQualityException {
	public InsufficientObservationsException(String message) {
		super(message);
	}
}
