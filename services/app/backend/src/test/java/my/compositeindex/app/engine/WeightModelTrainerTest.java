package my.compositeindex.app.engine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightModelTrainerTest {
	private final AtomicInteger ids = new AtomicInteger();
	private final WeightModelTrainer trainer = new WeightModelTrainer(new EntropyWeighter(), new PcaWeighter(),
			new AhpWeighter(), () -> "model-" + ids.incrementAndGet(),
			Clock.fixed(Instant.parse("2024-05-01T08:30:00Z"), ZoneOffset.UTC));

	@Test
	void dimensionWeightsSumMemberIndicators() {
		WeightModel model = trainer.trainEntropy(input(
				new IndicatorDefinition("a", "economy", Direction.POSITIVE),
				new IndicatorDefinition("b", "economy", Direction.POSITIVE),
				new IndicatorDefinition("c", "society", Direction.NEGATIVE)));

		assertThat(model.id()).isEqualTo("model-1");
		assertThat(model.createdAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 8, 30));
		assertThat(model.dimension2Weights().get("economy"))
				.isCloseTo(model.weight("a") + model.weight("b"), within(1e-12));
		assertThat(model.dimension2Weights().get("society")).isCloseTo(model.weight("c"), within(1e-12));
		assertThat(model.weights().values().stream().mapToDouble(Double::doubleValue).sum())
				.isCloseTo(1.0, within(WeightModel.SUM_TOLERANCE));
		assertThat(model.scoreScaling()).isNull();
		assertThat(model.standardizationParams()).containsOnlyKeys("a", "b", "c");
	}

	@Test
	void zScoreModelsCarryScoreScaling() {
		WeightModel model = trainer.trainPca(input(
				new IndicatorDefinition("a", null, Direction.POSITIVE),
				new IndicatorDefinition("b", null, Direction.POSITIVE),
				new IndicatorDefinition("c", null, Direction.POSITIVE)), 0.85);

		assertThat(model.dimension2Weights()).containsOnlyKeys(IndicatorDefinition.DEFAULT_DIMENSION);
		assertThat(model.scoreScaling()).isNotNull();
		assertThat(model.scoreScaling().scoreMin()).isLessThan(model.scoreScaling().scoreMax());
		assertThat(model.provenance()).isInstanceOf(MethodProvenance.Pca.class);
	}

	@Test
	void inconsistentAhpStillProducesFlaggedModel() {
		List<String> keys = List.of("a", "b", "c");
		PairwiseComparisonMatrix matrix = PairwiseComparisonMatrix.fromUpperTriangle(keys, List.of(
				List.of(1.0, 1.0, 1.0),
				List.of(1.0, 1.0, 9.0),
				List.of(1.0, 1.0 / 9.0, 1.0)));

		WeightModel model = trainer.trainAhp(input(
				new IndicatorDefinition("a", null, null),
				new IndicatorDefinition("b", null, null),
				new IndicatorDefinition("c", null, null)), matrix, StandardizationMethod.Z_SCORE);

		var provenance = (MethodProvenance.Ahp) model.provenance();
		assertThat(provenance.consistent()).isFalse();
		assertThat(model.method()).isEqualTo(WeightMethod.AHP);
		assertThat(model.weight("b")).isGreaterThan(model.weight("a"));
	}

	@Test
	void failedTrainingYieldsNoModel() {
		List<Observation> observations = List.of(
				new Observation("d", "A", 2020, new double[]{1.0, 3.0}),
				new Observation("d", "B", 2020, new double[]{2.0, 3.0}));
		TrainingInput input = new TrainingInput("x", List.of(
				new IndicatorDefinition("a", null, null),
				new IndicatorDefinition("flat", null, null)), observations, List.of("d"));

		assertThatThrownBy(() -> trainer.trainEntropy(input))
				.isInstanceOf(DegenerateIndicatorException.class)
				.hasMessageContaining("flat");
		assertThat(ids.get()).isZero();
	}

	@Test
	void normalizeRejectsZeroSum() {
		assertThatThrownBy(() -> WeightModelTrainer.normalize(new double[]{0.0, 0.0}))
				.isInstanceOf(AllIndicatorsUniformException.class);
		assertThat(WeightModelTrainer.normalize(new double[]{1.0, 3.0})).containsExactly(0.25, 0.75);
	}

	private static TrainingInput input(IndicatorDefinition... indicators) {
		double[][] values = {
				{1.0, 4.0, 10.0},
				{2.0, 3.5, 12.0},
				{3.0, 5.0, 9.0},
				{4.0, 1.0, 15.0},
				{5.0, 2.0, 11.0},
				{6.0, 6.0, 14.0}
		};
		List<Observation> observations = new ArrayList<>();
		for (int i = 0; i < values.length; i++) {
			observations.add(new Observation("d", "E" + i, 2020, values[i]));
		}
		return new TrainingInput("test", List.of(indicators), observations, List.of("d"));
	}
}
