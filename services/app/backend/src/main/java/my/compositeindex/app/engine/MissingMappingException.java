package my.compositeindex.app.engine;

public class MissingMappingException extends DataQualityException {
	public MissingMappingException(String message) {
		super(message);
	}
}
