package my.compositeindex.app.engine;

/**
 * One (entity, year) row with raw indicator values aligned to the resolver's indicator order.
 */
public record Observation(String datasetId, String entity, int year, double[] values) {
	public double value(int index) {
		return values[index];
	}
}
