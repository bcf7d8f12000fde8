package my.compositeindex.app.service;

import my.compositeindex.app.domain.Dataset;
import my.compositeindex.app.domain.StoredResultSet;
import my.compositeindex.app.domain.StoredWeightModel;
import my.compositeindex.app.dto.OnboardingDto;
import my.compositeindex.app.engine.ResultSet;
import my.compositeindex.app.engine.WeightMethod;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.repository.DatasetRepository;
import my.compositeindex.app.repository.ResultSetRepository;
import my.compositeindex.app.repository.WeightModelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class OnboardingServiceTest {
	private DatasetRepository datasetRepository;
	private WeightModelRepository weightModelRepository;
	private ResultSetRepository resultSetRepository;
	private OnboardingService service;

	@BeforeEach
	void setUp() {
		datasetRepository = mock(DatasetRepository.class);
		weightModelRepository = mock(WeightModelRepository.class);
		resultSetRepository = mock(ResultSetRepository.class);
		service = new OnboardingService(datasetRepository, weightModelRepository, resultSetRepository);
	}

	@Test
	void collectsOneModelAndResultPerMethod() {
		sampleDataset("sample_dataset");
		for (WeightMethod method : WeightMethod.values()) {
			String suffix = method.value();
			StoredWeightModel foreign = storedModel("other_" + suffix, "other_dataset");
			StoredWeightModel sample = storedModel("sample_model_" + suffix, "sample_dataset");
			when(weightModelRepository.findByMethodOrderByCreatedAtAsc(method)).thenReturn(List.of(foreign, sample));
			StoredResultSet sampleResult = storedResult("sample_result_" + suffix, "sample_dataset");
			when(resultSetRepository.findByWeightModelIdOrderByCreatedAtAsc("sample_model_" + suffix))
					.thenReturn(List.of(sampleResult));
		}

		OnboardingDto onboarding = service.getOnboarding();

		assertThat(onboarding.sampleDatasetId()).isEqualTo("sample_dataset");
		assertThat(onboarding.weightModelIds()).isEqualTo(Map.of(
				"entropy", "sample_model_entropy", "pca", "sample_model_pca", "ahp", "sample_model_ahp"));
		assertThat(onboarding.resultSetIds()).isEqualTo(Map.of(
				"entropy", "sample_result_entropy", "pca", "sample_result_pca", "ahp", "sample_result_ahp"));
	}

	@Test
	void missingSampleDatasetIsNotFound() {
		when(datasetRepository.findFirstBySampleTrueOrderByCreatedAtAsc()).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.getOnboarding())
				.isInstanceOf(NotFoundException.class)
				.hasMessageContaining("Sample dataset");
	}

	@Test
	void missingSampleModelIsNotFound() {
		sampleDataset("sample_dataset");
		StoredWeightModel foreign = storedModel("m1", "other_dataset");
		when(weightModelRepository.findByMethodOrderByCreatedAtAsc(WeightMethod.values()[0]))
				.thenReturn(List.of(foreign));

		assertThatThrownBy(() -> service.getOnboarding())
				.isInstanceOf(NotFoundException.class)
				.hasMessageContaining("Sample weight model not found");
	}

	private void sampleDataset(String id) {
		Dataset dataset = new Dataset();
		dataset.setDatasetId(id);
		dataset.setSample(true);
		when(datasetRepository.findFirstBySampleTrueOrderByCreatedAtAsc()).thenReturn(Optional.of(dataset));
	}

	private StoredWeightModel storedModel(String id, String datasetId) {
		WeightModel model = mock(WeightModel.class);
		when(model.trainedOnDatasetIds()).thenReturn(List.of(datasetId));
		StoredWeightModel stored = new StoredWeightModel();
		stored.setModelId(id);
		stored.setModel(model);
		return stored;
	}

	private StoredResultSet storedResult(String id, String datasetId) {
		ResultSet result = mock(ResultSet.class);
		when(result.datasetIds()).thenReturn(List.of(datasetId));
		StoredResultSet stored = new StoredResultSet();
		stored.setResultId(id);
		stored.setResult(result);
		return stored;
	}
}
