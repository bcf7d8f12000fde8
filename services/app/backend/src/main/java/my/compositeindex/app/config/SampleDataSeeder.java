package my.compositeindex.app.config;

import my.compositeindex.app.domain.DatasetSourceType;
import my.compositeindex.app.dto.IndicatorDto;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.PairwiseComparisonMatrix;
import my.compositeindex.app.engine.StandardizationMethod;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.importer.ParsedDataset;
import my.compositeindex.app.repository.DatasetRepository;
import my.compositeindex.app.service.DatasetService;
import my.compositeindex.app.service.IndexComputationService;
import my.compositeindex.app.service.IndicatorService;
import my.compositeindex.app.service.MappingService;
import my.compositeindex.app.service.WeightModelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds an empty installation with a sample dataset, its indicator library and mapping, one
 * model per weighting method and one result per model, all under fixed ids.
 */
@Component
public class SampleDataSeeder implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(SampleDataSeeder.class);

	static final String DATASET_RESOURCE = "classpath:sample/sample_dataset.csv";
	static final String INDICATORS_RESOURCE = "classpath:sample/sample_indicators.json";
	static final String SAMPLE_DATASET_ID = "sample_dataset";

	// order follows sample_indicators.json: production, sales, profit_margin, debt_ratio, rd_ratio
	static final List<List<Double>> SAMPLE_AHP_MATRIX = List.of(
			List.of(1.0, 1.0, 3.0, 5.0, 3.0),
			List.of(1.0, 1.0, 3.0, 5.0, 3.0),
			List.of(1.0 / 3, 1.0 / 3, 1.0, 3.0, 2.0),
			List.of(1.0 / 5, 1.0 / 5, 1.0 / 3, 1.0, 1.0 / 2),
			List.of(1.0 / 3, 1.0 / 3, 1.0 / 2, 2.0, 1.0)
	);

	private final AppProperties properties;
	private final DatasetRepository datasetRepository;
	private final DatasetService datasetService;
	private final IndicatorService indicatorService;
	private final MappingService mappingService;
	private final WeightModelService weightModelService;
	private final IndexComputationService computationService;
	private final IndexEngine indexEngine;
	private final ObjectMapper objectMapper;
	private final ResourceLoader resourceLoader;

	public SampleDataSeeder(AppProperties properties,
							DatasetRepository datasetRepository,
							DatasetService datasetService,
							IndicatorService indicatorService,
							MappingService mappingService,
							WeightModelService weightModelService,
							IndexComputationService computationService,
							IndexEngine indexEngine,
							ObjectMapper objectMapper,
							ResourceLoader resourceLoader) {
		this.properties = properties;
		this.datasetRepository = datasetRepository;
		this.datasetService = datasetService;
		this.indicatorService = indicatorService;
		this.mappingService = mappingService;
		this.weightModelService = weightModelService;
		this.computationService = computationService;
		this.indexEngine = indexEngine;
		this.objectMapper = objectMapper;
		this.resourceLoader = resourceLoader;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!properties.sample().enabled()) {
			return;
		}
		if (datasetRepository.count() > 0) {
			return;
		}
		try {
			seed();
		} catch (Exception ex) {
			logger.error("Failed to seed sample data: {}", ex.getMessage(), ex);
		}
	}

	void seed() throws IOException {
		Resource datasetResource = resourceLoader.getResource(DATASET_RESOURCE);
		Resource indicatorsResource = resourceLoader.getResource(INDICATORS_RESOURCE);
		if (!datasetResource.exists() || !indicatorsResource.exists()) {
			logger.warn("Sample resources not found: {} / {}", DATASET_RESOURCE, INDICATORS_RESOURCE);
			return;
		}

		ParsedDataset parsed = datasetService.parseCsv(read(datasetResource), null);
		datasetService.createDataset(SAMPLE_DATASET_ID, "Sample Data", DatasetSourceType.SAMPLE, parsed);

		List<IndicatorDto> indicators;
		try (InputStream inputStream = indicatorsResource.getInputStream()) {
			indicators = objectMapper.readValue(inputStream, new TypeReference<>() {
			});
		}
		Map<String, String> identity = new LinkedHashMap<>();
		for (IndicatorDto indicator : indicators) {
			indicatorService.upsertIndicator(indicator);
			identity.put(indicator.key(), indicator.key());
		}
		mappingService.putMapping(SAMPLE_DATASET_ID, identity);

		List<String> keys = List.copyOf(identity.keySet());
		List<String> datasets = List.of(SAMPLE_DATASET_ID);
		WeightModel entropy = indexEngine.trainEntropy("Sample / Entropy", keys, datasets)
				.withId("sample_model_entropy");
		WeightModel pca = indexEngine.trainPca("Sample / PCA", keys, datasets, properties.engine().pcaCumVarThreshold())
				.withId("sample_model_pca");
		WeightModel ahp = indexEngine.trainAhp("Sample / AHP", keys, datasets,
						PairwiseComparisonMatrix.fromUpperTriangle(keys, SAMPLE_AHP_MATRIX), StandardizationMethod.Z_SCORE)
				.withId("sample_model_ahp");

		seedResult(entropy, "sample_result_entropy", "Sample Result / Entropy");
		seedResult(pca, "sample_result_pca", "Sample Result / PCA");
		seedResult(ahp, "sample_result_ahp", "Sample Result / AHP");
		logger.info("Seeded sample dataset '{}' with {} rows, {} indicators, 3 models and 3 results",
				SAMPLE_DATASET_ID, parsed.rows().size(), indicators.size());
	}

	private void seedResult(WeightModel model, String resultId, String name) {
		weightModelService.save(model);
		computationService.save(indexEngine.computeIndex(model, List.of(SAMPLE_DATASET_ID), name).withId(resultId));
	}

	private String read(Resource resource) throws IOException {
		try (InputStream inputStream = resource.getInputStream()) {
			return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
