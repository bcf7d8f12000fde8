package my.compositeindex.app.service;

import my.compositeindex.app.config.AppProperties;
import my.compositeindex.app.domain.StoredWeightModel;
import my.compositeindex.app.dto.AhpWeightModelRequest;
import my.compositeindex.app.dto.TrainWeightModelRequest;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.PairwiseComparisonMatrix;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.repository.WeightModelRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class WeightModelService {
	private final WeightModelRepository weightModelRepository;
	private final IndexEngine indexEngine;
	private final AppProperties properties;

	public WeightModelService(WeightModelRepository weightModelRepository,
							  IndexEngine indexEngine,
							  AppProperties properties) {
		this.weightModelRepository = weightModelRepository;
		this.indexEngine = indexEngine;
		this.properties = properties;
	}

	public List<WeightModel> listModels() {
		return weightModelRepository.findAllOrderByCreatedAtDesc().stream()
				.map(StoredWeightModel::getModel)
				.toList();
	}

	public WeightModel getModel(String modelId) {
		return weightModelRepository.findById(modelId)
				.map(StoredWeightModel::getModel)
				.orElseThrow(() -> new NotFoundException("Weight model not found: " + modelId));
	}

	@Transactional
	public WeightModel train(TrainWeightModelRequest request) {
		WeightModel model = switch (request.method()) {
			case ENTROPY -> indexEngine.trainEntropy(request.name(), request.indicatorKeys(), request.trainingDatasetIds());
			case PCA -> indexEngine.trainPca(request.name(), request.indicatorKeys(), request.trainingDatasetIds(),
					request.pcaCumVarThreshold() == null
							? properties.engine().pcaCumVarThreshold()
							: request.pcaCumVarThreshold());
			case AHP -> throw new IllegalArgumentException("AHP models are created from a judgment matrix via /api/weight-models/ahp");
		};
		return save(model);
	}

	@Transactional
	public WeightModel trainAhp(AhpWeightModelRequest request) {
		List<String> keys = trimmed(request.indicatorKeys());
		PairwiseComparisonMatrix matrix = PairwiseComparisonMatrix.fromUpperTriangle(keys, request.matrix());
		WeightModel model = indexEngine.trainAhp(request.name(), keys,
				request.standardizationDatasetIds(), matrix, request.standardizationMethod());
		return save(model);
	}

	private static List<String> trimmed(List<String> keys) {
		if (keys == null) {
			return List.of();
		}
		return keys.stream().map(key -> key == null ? null : key.trim()).toList();
	}

	@Transactional
	public WeightModel save(WeightModel model) {
		weightModelRepository.save(StoredWeightModel.of(model));
		return model;
	}
}
