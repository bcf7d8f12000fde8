package my.compositeindex.app.config;

import my.compositeindex.app.domain.DatasetSourceType;
import my.compositeindex.app.dto.IndicatorDto;
import my.compositeindex.app.engine.AhpWeighter;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.MethodProvenance;
import my.compositeindex.app.engine.PairwiseComparisonMatrix;
import my.compositeindex.app.engine.ResultSet;
import my.compositeindex.app.engine.StandardizationMethod;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.importer.DatasetCsvParser;
import my.compositeindex.app.importer.ParsedDataset;
import my.compositeindex.app.repository.DatasetRepository;
import my.compositeindex.app.service.DatasetService;
import my.compositeindex.app.service.IndexComputationService;
import my.compositeindex.app.service.IndicatorService;
import my.compositeindex.app.service.MappingService;
import my.compositeindex.app.service.WeightModelService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class SampleDataSeederTest {
	private static final List<String> SAMPLE_KEYS = List.of("production", "sales", "profit_margin", "debt_ratio", "rd_ratio");

	private DatasetRepository datasetRepository;
	private DatasetService datasetService;
	private IndicatorService indicatorService;
	private MappingService mappingService;
	private WeightModelService weightModelService;
	private IndexComputationService computationService;
	private IndexEngine indexEngine;

	@BeforeEach
	void setUp() {
		datasetRepository = mock(DatasetRepository.class);
		datasetService = mock(DatasetService.class);
		indicatorService = mock(IndicatorService.class);
		mappingService = mock(MappingService.class);
		weightModelService = mock(WeightModelService.class);
		computationService = mock(IndexComputationService.class);
		indexEngine = mock(IndexEngine.class);
	}

	@Test
	void skipsWhenDisabled() {
		seeder(false).run(null);

		verifyNoInteractions(datasetRepository, datasetService, indexEngine);
	}

	@Test
	void skipsWhenDatasetsExist() {
		when(datasetRepository.count()).thenReturn(3L);

		seeder(true).run(null);

		verifyNoInteractions(datasetService, indicatorService, indexEngine);
	}

	@Test
	void seedsDatasetIndicatorsModelsAndResults() {
		when(datasetRepository.count()).thenReturn(0L);
		when(datasetService.parseCsv(anyString(), isNull()))
				.thenAnswer(invocation -> new DatasetCsvParser().parse(invocation.getArgument(0), null));
		WeightModel entropy = stubModel("sample_model_entropy");
		WeightModel pca = stubModel("sample_model_pca");
		WeightModel ahp = stubModel("sample_model_ahp");
		when(indexEngine.trainEntropy(anyString(), anyList(), anyList())).thenReturn(entropy);
		when(indexEngine.trainPca(anyString(), anyList(), anyList(), anyDouble())).thenReturn(pca);
		when(indexEngine.trainAhp(anyString(), anyList(), anyList(), any(), any())).thenReturn(ahp);
		ResultSet result = mock(ResultSet.class);
		when(result.withId(anyString())).thenReturn(result);
		when(indexEngine.computeIndex(any(), anyList(), anyString())).thenReturn(result);

		seeder(true).run(null);

		ArgumentCaptor<ParsedDataset> parsed = ArgumentCaptor.forClass(ParsedDataset.class);
		verify(datasetService).createDataset(eq(SampleDataSeeder.SAMPLE_DATASET_ID), anyString(),
				eq(DatasetSourceType.SAMPLE), parsed.capture());
		assertThat(parsed.getValue().rows()).hasSize(24);
		assertThat(parsed.getValue().columns()).containsAll(SAMPLE_KEYS);

		ArgumentCaptor<IndicatorDto> indicators = ArgumentCaptor.forClass(IndicatorDto.class);
		verify(indicatorService, times(5)).upsertIndicator(indicators.capture());
		assertThat(indicators.getAllValues()).extracting(IndicatorDto::key).containsExactlyElementsOf(SAMPLE_KEYS);

		verify(mappingService).putMapping(eq(SampleDataSeeder.SAMPLE_DATASET_ID), eq(Map.of(
				"production", "production", "sales", "sales", "profit_margin", "profit_margin",
				"debt_ratio", "debt_ratio", "rd_ratio", "rd_ratio")));
		verify(indexEngine).trainAhp(anyString(), eq(SAMPLE_KEYS), eq(List.of(SampleDataSeeder.SAMPLE_DATASET_ID)),
				any(PairwiseComparisonMatrix.class), eq(StandardizationMethod.Z_SCORE));
		verify(weightModelService).save(entropy);
		verify(weightModelService).save(pca);
		verify(weightModelService).save(ahp);
		verify(result).withId("sample_result_entropy");
		verify(result).withId("sample_result_pca");
		verify(result).withId("sample_result_ahp");
		verify(computationService, times(3)).save(result);
	}

	@Test
	void seedingFailureDoesNotPropagate() {
		when(datasetRepository.count()).thenReturn(0L);
		when(datasetService.parseCsv(anyString(), isNull())).thenThrow(new IllegalArgumentException("boom"));

		seeder(true).run(null);

		verifyNoInteractions(indexEngine);
	}

	@Test
	void sampleJudgmentsAreConsistent() {
		PairwiseComparisonMatrix matrix = PairwiseComparisonMatrix.fromUpperTriangle(SAMPLE_KEYS,
				SampleDataSeeder.SAMPLE_AHP_MATRIX);

		var provenance = (MethodProvenance.Ahp) new AhpWeighter().weigh(matrix).provenance();

		assertThat(provenance.consistent()).isTrue();
	}

	private WeightModel stubModel(String id) {
		WeightModel model = mock(WeightModel.class);
		when(model.withId(id)).thenReturn(model);
		return model;
	}

	private SampleDataSeeder seeder(boolean enabled) {
		AppProperties properties = new AppProperties(null, new AppProperties.Engine(0.85, 0.10, 100, 50),
				new AppProperties.Sample(enabled));
		return new SampleDataSeeder(properties, datasetRepository, datasetService, indicatorService, mappingService,
				weightModelService, computationService, indexEngine, JsonMapper.builder().build(),
				new DefaultResourceLoader());
	}
}
