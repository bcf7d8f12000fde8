package my.compositeindex.app.engine;

public class AllIndicatorsUniformException extends DataQualityException {
	public AllIndicatorsUniformException(String message) {
		super(message);
	}
}
