package my.compositeindex.app.engine;

/**
 * A row skipped during aggregation. Non-fatal: the rest of the run continues.
 */
public record RowFailure(String datasetId,
						 String entity,
						 int year,
						 String indicatorKey,
						 FailureCause cause,
						 String message) {
}
