package my.compositeindex.app.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for training weight models and computing composite indices.
 * <p>
 * Datasets, mappings and the indicator catalog are reached only through the injected readers,
 * so every call is a function of its explicit inputs and of what those readers return. The
 * engine persists nothing; callers store the returned models and result sets.
 */
public class IndexEngine {
	private static final Logger logger = LoggerFactory.getLogger(IndexEngine.class);

	private final DatasetReader datasetReader;
	private final MappingReader mappingReader;
	private final IndicatorCatalog indicatorCatalog;
	private final WeightModelTrainer trainer;
	private final IndexAggregator aggregator;
	private final Clock clock;

	public IndexEngine(DatasetReader datasetReader,
					   MappingReader mappingReader,
					   IndicatorCatalog indicatorCatalog,
					   WeightModelTrainer trainer,
					   IndexAggregator aggregator,
					   Clock clock) {
		this.datasetReader = datasetReader;
		this.mappingReader = mappingReader;
		this.indicatorCatalog = indicatorCatalog;
		this.trainer = trainer;
		this.aggregator = aggregator;
		this.clock = clock;
	}

	public WeightModel trainEntropy(String name, List<String> indicatorKeys, List<String> datasetIds) {
		return trainer.trainEntropy(trainingInput(name, indicatorKeys, datasetIds));
	}

	public WeightModel trainPca(String name, List<String> indicatorKeys, List<String> datasetIds,
								double cumulativeVarianceThreshold) {
		return trainer.trainPca(trainingInput(name, indicatorKeys, datasetIds), cumulativeVarianceThreshold);
	}

	public WeightModel trainAhp(String name, List<String> indicatorKeys, List<String> datasetIds,
								PairwiseComparisonMatrix matrix, StandardizationMethod standardization) {
		if (matrix == null) {
			throw new ValidationException("AHP requires a pairwise comparison matrix");
		}
		return trainer.trainAhp(trainingInput(name, indicatorKeys, datasetIds), matrix, standardization);
	}

	public ResultSet computeIndex(WeightModel model, List<String> datasetIds, String name) {
		if (model == null) {
			throw new ValidationException("Weight model is required");
		}
		List<String> ids = distinct(datasetIds, "dataset");
		List<IndexAggregator.Source> sources = new ArrayList<>();
		for (String datasetId : ids) {
			sources.add(new IndexAggregator.Source(datasetReader.read(datasetId), mappingReader.read(datasetId)));
		}
		IndexAggregator.Aggregation aggregation = aggregator.aggregate(model, sources);
		if (!aggregation.failures().isEmpty()) {
			logger.warn("Index computation with model {} skipped {} row(s); {} row(s) scored",
					model.id(), aggregation.failures().size(), aggregation.rows().size());
			for (RowFailure failure : aggregation.failures()) {
				logger.debug("Skipped row {}-{} in dataset {}: {} ({})", failure.entity(), failure.year(),
						failure.datasetId(), failure.cause().value(), failure.message());
			}
		} else {
			logger.info("Index computation with model {} scored {} row(s)", model.id(), aggregation.rows().size());
		}
		String resultName = name == null || name.isBlank() ? "Result / " + model.name() : name.trim();
		return new ResultSet(UUID.randomUUID().toString().replace("-", ""), resultName, LocalDateTime.now(clock), ids,
				model.id(), IndexAggregator.columns(model), aggregation.rows(), aggregation.failures());
	}

	private TrainingInput trainingInput(String name, List<String> indicatorKeys, List<String> datasetIds) {
		List<String> keys = distinct(indicatorKeys, "indicator");
		List<String> ids = distinct(datasetIds, "dataset");

		List<IndicatorDefinition> indicators = new ArrayList<>();
		List<String> unknown = new ArrayList<>();
		for (String key : keys) {
			indicatorCatalog.find(key).ifPresentOrElse(indicators::add, () -> unknown.add(key));
		}
		if (!unknown.isEmpty()) {
			throw new ValidationException("Unknown indicators: " + unknown);
		}

		ObservationResolver resolver = new ObservationResolver(keys);
		List<Observation> observations = new ArrayList<>();
		Map<String, String> firstSeenIn = new HashMap<>();
		for (String datasetId : ids) {
			for (Observation observation : resolver.resolveStrict(datasetReader.read(datasetId), mappingReader.read(datasetId))) {
				String key = observation.entity() + "\u0000" + observation.year();
				String previous = firstSeenIn.putIfAbsent(key, datasetId);
				if (previous != null) {
					throw new ValidationException("Duplicate entity/year " + observation.entity() + "-" + observation.year()
							+ " in dataset " + datasetId + " (already present in dataset " + previous + ")");
				}
				observations.add(observation);
			}
		}
		String modelName = name == null || name.isBlank() ? "Weight model" : name.trim();
		return new TrainingInput(modelName, indicators, observations, ids);
	}

	private static List<String> distinct(List<String> values, String label) {
		if (values == null || values.isEmpty()) {
			throw new ValidationException("At least one " + label + " is required");
		}
		Set<String> unique = new LinkedHashSet<>();
		for (String value : values) {
			if (value == null || value.isBlank()) {
				throw new ValidationException("Blank " + label + " id");
			}
			if (!unique.add(value.trim())) {
				throw new ValidationException("Duplicate " + label + ": " + value);
			}
		}
		return List.copyOf(unique);
	}
}
