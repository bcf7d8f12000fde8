package my.compositeindex.app.engine;

/**
 * An indicator carries no information (constant or all-zero column) and cannot be weighted.
 */
public class DegenerateIndicatorException extends InsufficientDataException {
	private final String indicatorKey;

	public DegenerateIndicatorException(String indicatorKey, String message) {
		super(message);
		this.indicatorKey = indicatorKey;
	}

	public String getIndicatorKey() {
		return indicatorKey;
	}
}
