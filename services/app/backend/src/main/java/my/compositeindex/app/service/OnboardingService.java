package my.compositeindex.app.service;

import my.compositeindex.app.domain.Dataset;
import my.compositeindex.app.domain.StoredResultSet;
import my.compositeindex.app.domain.StoredWeightModel;
import my.compositeindex.app.dto.OnboardingDto;
import my.compositeindex.app.engine.WeightMethod;
import my.compositeindex.app.repository.DatasetRepository;
import my.compositeindex.app.repository.ResultSetRepository;
import my.compositeindex.app.repository.WeightModelRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Names the seeded sample dataset together with one model and one result per weighting method.
 */
@Service
public class OnboardingService {
	private final DatasetRepository datasetRepository;
	private final WeightModelRepository weightModelRepository;
	private final ResultSetRepository resultSetRepository;

	public OnboardingService(DatasetRepository datasetRepository,
							 WeightModelRepository weightModelRepository,
							 ResultSetRepository resultSetRepository) {
		this.datasetRepository = datasetRepository;
		this.weightModelRepository = weightModelRepository;
		this.resultSetRepository = resultSetRepository;
	}

	public OnboardingDto getOnboarding() {
		Dataset sample = datasetRepository.findFirstBySampleTrueOrderByCreatedAtAsc()
				.orElseThrow(() -> new NotFoundException("Sample dataset not found"));
		String sampleId = sample.getDatasetId();
		Map<String, String> modelIds = new LinkedHashMap<>();
		Map<String, String> resultIds = new LinkedHashMap<>();
		for (WeightMethod method : WeightMethod.values()) {
			String modelId = weightModelRepository.findByMethodOrderByCreatedAtAsc(method).stream()
					.filter(model -> model.getModel().trainedOnDatasetIds().contains(sampleId))
					.map(StoredWeightModel::getModelId)
					.findFirst()
					.orElseThrow(() -> new NotFoundException("Sample weight model not found: " + method.value()));
			String resultId = resultSetRepository.findByWeightModelIdOrderByCreatedAtAsc(modelId).stream()
					.filter(result -> result.getResult().datasetIds().contains(sampleId))
					.map(StoredResultSet::getResultId)
					.findFirst()
					.orElseThrow(() -> new NotFoundException("Sample result not found for model: " + modelId));
			modelIds.put(method.value(), modelId);
			resultIds.put(method.value(), resultId);
		}
		return new OnboardingDto(sampleId, modelIds, resultIds);
	}
}
