package my.compositeindex.app.config;

import my.compositeindex.app.engine.AhpWeighter;
import my.compositeindex.app.engine.DatasetReader;
import my.compositeindex.app.engine.EntropyWeighter;
import my.compositeindex.app.engine.IndexAggregator;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.IndicatorCatalog;
import my.compositeindex.app.engine.MappingReader;
import my.compositeindex.app.engine.PcaWeighter;
import my.compositeindex.app.engine.WeightModelTrainer;
import my.compositeindex.app.engine.linalg.DominantEigenSolver;
import my.compositeindex.app.engine.linalg.SymmetricEigenSolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
public class EngineConfig {
	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public WeightModelTrainer weightModelTrainer(AppProperties properties, Clock clock) {
		AppProperties.Engine engine = properties.engine();
		return new WeightModelTrainer(
				new EntropyWeighter(),
				new PcaWeighter(new SymmetricEigenSolver(engine.eigenMaxSweeps())),
				new AhpWeighter(new DominantEigenSolver(), engine.ahpConsistencyThreshold()),
				() -> UUID.randomUUID().toString().replace("-", ""),
				clock);
	}

	@Bean
	public IndexAggregator indexAggregator() {
		return new IndexAggregator();
	}

	@Bean
	public IndexEngine indexEngine(DatasetReader datasetReader,
								   MappingReader mappingReader,
								   IndicatorCatalog indicatorCatalog,
								   WeightModelTrainer weightModelTrainer,
								   IndexAggregator indexAggregator,
								   Clock clock) {
		return new IndexEngine(datasetReader, mappingReader, indicatorCatalog, weightModelTrainer, indexAggregator, clock);
	}
}
