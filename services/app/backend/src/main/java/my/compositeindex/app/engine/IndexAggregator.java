package my.compositeindex.app.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies a trained model to raw tables. Rows that cannot be resolved are reported, not fatal.
 * <p>
 * Min-max models score {@code 100 * sum(w_j * s_j)} directly; z-score models map the raw
 * composite through the model's frozen score range. Both are clamped to [0, 100].
 */
public class IndexAggregator {
	public static final String COLUMN_ENTITY = "entity";
	public static final String COLUMN_YEAR = "year";
	public static final String COLUMN_SCORE_RAW = "score_raw";
	public static final String COLUMN_INDEX = "index_0_100";

	public Aggregation aggregate(WeightModel model, List<Source> sources) {
		List<IndicatorDefinition> indicators = model.indicators();
		double[] weights = new double[indicators.size()];
		for (int j = 0; j < indicators.size(); j++) {
			weights[j] = model.weight(indicators.get(j).key());
		}
		CompositeScorer scorer = new CompositeScorer(indicators, weights, model.dimension2Weights());
		ObservationResolver resolver = new ObservationResolver(model.indicatorKeys());

		List<ResultRow> rows = new ArrayList<>();
		List<RowFailure> failures = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (Source source : sources) {
			ObservationResolver.Resolution resolution = resolver.resolve(source.table(), source.mapping());
			failures.addAll(resolution.failures());
			for (Observation observation : resolution.observations()) {
				if (!seen.add(observation.entity() + "\u0000" + observation.year())) {
					failures.add(new RowFailure(observation.datasetId(), observation.entity(), observation.year(), null,
							FailureCause.DUPLICATE_KEY,
							"Duplicate entity/year " + observation.entity() + "-" + observation.year() + " already scored"));
					continue;
				}
				rows.add(score(model, scorer, observation));
			}
		}
		return new Aggregation(rows, failures);
	}

	/**
	 * Result table header: identifiers, composite, one raw/0..100 pair per dimension (sorted), then raw inputs.
	 */
	public static List<String> columns(WeightModel model) {
		List<String> columns = new ArrayList<>(List.of(COLUMN_ENTITY, COLUMN_YEAR, COLUMN_SCORE_RAW, COLUMN_INDEX));
		for (String dimension : new TreeSet<>(model.dimension2Weights().keySet())) {
			if (model.dimension2Weights().get(dimension) > 0.0) {
				columns.add(subScoreColumn(dimension));
				columns.add(subindexColumn(dimension));
			}
		}
		for (String key : model.indicatorKeys()) {
			columns.add(rawColumn(key));
		}
		return columns;
	}

	public static String subScoreColumn(String dimension) {
		return "sub_score_raw." + dimension;
	}

	public static String subindexColumn(String dimension) {
		return "subindex." + dimension + "_0_100";
	}

	public static String rawColumn(String indicatorKey) {
		return "raw." + indicatorKey;
	}

	private ResultRow score(WeightModel model, CompositeScorer scorer, Observation observation) {
		List<IndicatorDefinition> indicators = model.indicators();
		double[] standardized = new double[indicators.size()];
		Map<String, Double> raw = new LinkedHashMap<>();
		for (int j = 0; j < indicators.size(); j++) {
			IndicatorDefinition indicator = indicators.get(j);
			StandardizationParams params = model.standardizationParams().get(indicator.key());
			standardized[j] = Standardizer.apply(params, indicator.direction(), observation.value(j));
			raw.put(indicator.key(), observation.value(j));
		}
		CompositeScorer.RawScores scores = scorer.score(standardized);

		boolean bounded = model.standardizationMethod() == StandardizationMethod.MIN_MAX;
		ScoreScaling scaling = model.scoreScaling();
		double index = bounded
				? ScoreScaling.clampIndex(100.0 * scores.composite())
				: scaling.scaleComposite(scores.composite());
		Map<String, Double> subindex = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : scores.byDimension().entrySet()) {
			subindex.put(entry.getKey(), bounded
					? ScoreScaling.clampIndex(100.0 * entry.getValue())
					: scaling.scaleDimension(entry.getKey(), entry.getValue()));
		}
		return new ResultRow(observation.datasetId(), observation.entity(), observation.year(),
				scores.composite(), index, scores.byDimension(), subindex, raw);
	}

	public record Source(SourceTable table, ColumnMapping mapping) {
	}

	public record Aggregation(List<ResultRow> rows, List<RowFailure> failures) {
	}
}
