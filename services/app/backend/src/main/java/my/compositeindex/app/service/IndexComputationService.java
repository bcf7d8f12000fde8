package my.compositeindex.app.service;

import my.compositeindex.app.config.AppProperties;
import my.compositeindex.app.domain.StoredResultSet;
import my.compositeindex.app.dto.ComputeRequest;
import my.compositeindex.app.dto.ComputeResponseDto;
import my.compositeindex.app.dto.ResultDetailDto;
import my.compositeindex.app.dto.ResultRowsDto;
import my.compositeindex.app.dto.ResultSummaryDto;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.ResultSet;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.repository.ResultSetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Applies persisted weight models to datasets and serves the stored result sets.
 */
@Service
public class IndexComputationService {
	private final ResultSetRepository resultSetRepository;
	private final WeightModelService weightModelService;
	private final IndexEngine indexEngine;
	private final AppProperties properties;

	public IndexComputationService(ResultSetRepository resultSetRepository,
								   WeightModelService weightModelService,
								   IndexEngine indexEngine,
								   AppProperties properties) {
		this.resultSetRepository = resultSetRepository;
		this.weightModelService = weightModelService;
		this.indexEngine = indexEngine;
		this.properties = properties;
	}

	@Transactional
	public ComputeResponseDto compute(ComputeRequest request) {
		WeightModel model = weightModelService.getModel(request.weightModelId());
		ResultSet result = save(indexEngine.computeIndex(model, request.datasetIds(), request.name()));
		return new ComputeResponseDto(result.id(), result.rowCount(), result.failedRowCount());
	}

	@Transactional
	public ResultSet save(ResultSet result) {
		resultSetRepository.save(StoredResultSet.of(result));
		return result;
	}

	public List<ResultSummaryDto> listResults() {
		return resultSetRepository.findAllOrderByCreatedAtDesc().stream()
				.map(StoredResultSet::getResult)
				.map(this::toSummary)
				.toList();
	}

	public ResultDetailDto getResult(String resultId) {
		ResultSet result = findResult(resultId);
		return new ResultDetailDto(result.id(), result.name(), result.createdAt(), result.datasetIds(),
				result.weightModelId(), result.rowCount(), result.failedRowCount(), result.columns(),
				ResultTableWriter.records(result, properties.engine().previewRows()), result.failures());
	}

	public ResultRowsDto getRows(String resultId) {
		ResultSet result = findResult(resultId);
		return new ResultRowsDto(result.columns(), ResultTableWriter.records(result, Integer.MAX_VALUE), result.failures());
	}

	public ResultDownload download(String resultId) {
		ResultSet result = findResult(resultId);
		return new ResultDownload(result.name() + ".csv", ResultTableWriter.csv(result));
	}

	public ResultSet findResult(String resultId) {
		return resultSetRepository.findById(resultId)
				.map(StoredResultSet::getResult)
				.orElseThrow(() -> new NotFoundException("Result set not found: " + resultId));
	}

	private ResultSummaryDto toSummary(ResultSet result) {
		return new ResultSummaryDto(result.id(), result.name(), result.createdAt(), result.datasetIds(),
				result.weightModelId(), result.rowCount(), result.failedRowCount(), result.columns());
	}

	public record ResultDownload(String filename, String content) {
	}
}
