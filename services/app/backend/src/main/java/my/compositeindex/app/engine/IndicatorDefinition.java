package my.compositeindex.app.engine;

/**
 * Catalog entry as seen by the engine. A blank dimension falls into {@value #DEFAULT_DIMENSION}.
 */
public record IndicatorDefinition(String key, String dimension2Key, Direction direction) {
	public static final String DEFAULT_DIMENSION = "default";

	public IndicatorDefinition {
		if (key == null || key.isBlank()) {
			throw new ValidationException("Indicator key is required");
		}
		dimension2Key = dimension2Key == null || dimension2Key.isBlank() ? DEFAULT_DIMENSION : dimension2Key.trim();
		direction = direction == null ? Direction.POSITIVE : direction;
	}
}
