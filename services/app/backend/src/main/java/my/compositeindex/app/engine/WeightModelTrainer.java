package my.compositeindex.app.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Fits standardization, runs one weighter and assembles an immutable {@link WeightModel}.
 * Any failure aborts the whole training run; no partially trained model is ever returned.
 */
public class WeightModelTrainer {
	private static final Logger logger = LoggerFactory.getLogger(WeightModelTrainer.class);

	private final EntropyWeighter entropyWeighter;
	private final PcaWeighter pcaWeighter;
	private final AhpWeighter ahpWeighter;
	private final Supplier<String> idSupplier;
	private final Clock clock;

	public WeightModelTrainer() {
		this(new EntropyWeighter(), new PcaWeighter(), new AhpWeighter(), WeightModelTrainer::newId, Clock.systemUTC());
	}

	public WeightModelTrainer(EntropyWeighter entropyWeighter,
							  PcaWeighter pcaWeighter,
							  AhpWeighter ahpWeighter,
							  Supplier<String> idSupplier,
							  Clock clock) {
		this.entropyWeighter = entropyWeighter;
		this.pcaWeighter = pcaWeighter;
		this.ahpWeighter = ahpWeighter;
		this.idSupplier = idSupplier;
		this.clock = clock;
	}

	public WeightModel trainEntropy(TrainingInput input) {
		Fitted fitted = fit(input, StandardizationMethod.MIN_MAX);
		Weighting weighting = entropyWeighter.weigh(input.indicatorKeys(), fitted.standardized());
		return assemble(input, WeightMethod.ENTROPY, fitted, weighting);
	}

	public WeightModel trainPca(TrainingInput input, double cumulativeVarianceThreshold) {
		Fitted fitted = fit(input, StandardizationMethod.Z_SCORE);
		Weighting weighting = pcaWeighter.weigh(input.indicatorKeys(), fitted.standardized(), cumulativeVarianceThreshold);
		MethodProvenance.Pca provenance = (MethodProvenance.Pca) weighting.provenance();
		logger.info("PCA retained {} of {} components (cumulative variance {}, threshold {})",
				provenance.componentsRetained(), input.indicators().size(),
				provenance.cumulativeVariance().get(provenance.componentsRetained() - 1), cumulativeVarianceThreshold);
		return assemble(input, WeightMethod.PCA, fitted, weighting);
	}

	public WeightModel trainAhp(TrainingInput input, PairwiseComparisonMatrix matrix, StandardizationMethod standardization) {
		if (!matrix.indicatorKeys().equals(input.indicatorKeys())) {
			throw new ValidationException("AHP matrix indicators " + matrix.indicatorKeys()
					+ " do not match requested indicators " + input.indicatorKeys());
		}
		Fitted fitted = fit(input, standardization == null ? StandardizationMethod.Z_SCORE : standardization);
		Weighting weighting = ahpWeighter.weigh(matrix);
		MethodProvenance.Ahp provenance = (MethodProvenance.Ahp) weighting.provenance();
		if (!provenance.consistent()) {
			logger.warn("AHP judgment matrix for '{}' is inconsistent (CR={} >= {}); model is created anyway",
					input.name(), provenance.consistencyRatio(), provenance.consistencyThreshold());
		}
		return assemble(input, WeightMethod.AHP, fitted, weighting);
	}

	private Fitted fit(TrainingInput input, StandardizationMethod method) {
		List<IndicatorDefinition> indicators = input.indicators();
		List<Observation> observations = input.observations();
		Map<String, StandardizationParams> params = new LinkedHashMap<>();
		for (int j = 0; j < indicators.size(); j++) {
			double[] column = new double[observations.size()];
			for (int i = 0; i < observations.size(); i++) {
				column[i] = observations.get(i).value(j);
			}
			IndicatorDefinition indicator = indicators.get(j);
			params.put(indicator.key(), Standardizer.fit(method, indicator.key(), indicator.direction(), column));
		}
		return new Fitted(method, params, Standardizer.standardize(indicators, params, observations));
	}

	private WeightModel assemble(TrainingInput input, WeightMethod method, Fitted fitted, Weighting weighting) {
		List<IndicatorDefinition> indicators = input.indicators();
		double[] weights = normalize(weighting.weights());
		Map<String, Double> weightsByKey = new LinkedHashMap<>();
		for (int j = 0; j < indicators.size(); j++) {
			weightsByKey.put(indicators.get(j).key(), weights[j]);
		}
		Map<String, Double> dimensionWeights = CompositeScorer.dimensionWeights(indicators, weights);

		ScoreScaling scaling = null;
		if (fitted.method() == StandardizationMethod.Z_SCORE) {
			scaling = scaling(new CompositeScorer(indicators, weights, dimensionWeights), fitted.standardized());
		}

		WeightModel model = new WeightModel(
				idSupplier.get(),
				input.name(),
				LocalDateTime.now(clock),
				method,
				input.indicatorKeys(),
				indicators,
				weightsByKey,
				dimensionWeights,
				fitted.method(),
				fitted.params(),
				scaling,
				input.datasetIds(),
				weighting.provenance());
		logger.info("Trained {} weight model {} on {} observations x {} indicators",
				method.value(), model.id(), input.observations().size(), indicators.size());
		return model;
	}

	private ScoreScaling scaling(CompositeScorer scorer, double[][] standardized) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		Map<String, Double> subMin = new LinkedHashMap<>();
		Map<String, Double> subMax = new LinkedHashMap<>();
		for (double[] row : standardized) {
			CompositeScorer.RawScores scores = scorer.score(row);
			min = Math.min(min, scores.composite());
			max = Math.max(max, scores.composite());
			for (Map.Entry<String, Double> entry : scores.byDimension().entrySet()) {
				subMin.merge(entry.getKey(), entry.getValue(), Math::min);
				subMax.merge(entry.getKey(), entry.getValue(), Math::max);
			}
		}
		return new ScoreScaling(min, max, subMin, subMax);
	}

	/**
	 * Renormalizes so that the weights sum to exactly 1 up to rounding.
	 */
	static double[] normalize(double[] weights) {
		double sum = 0.0;
		for (double w : weights) {
			sum += w;
		}
		if (!(sum > 0.0)) {
			throw new AllIndicatorsUniformException("Weights sum to zero");
		}
		double[] out = new double[weights.length];
		for (int j = 0; j < weights.length; j++) {
			out[j] = weights[j] / sum;
		}
		return out;
	}

	private static String newId() {
		return UUID.randomUUID().toString().replace("-", "");
	}

	private record Fitted(StandardizationMethod method, Map<String, StandardizationParams> params, double[][] standardized) {
	}
}
