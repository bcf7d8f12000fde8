package my.compositeindex.app.service;

import my.compositeindex.app.config.AppProperties;
import my.compositeindex.app.domain.StoredResultSet;
import my.compositeindex.app.dto.ComputeRequest;
import my.compositeindex.app.dto.ComputeResponseDto;
import my.compositeindex.app.dto.ResultDetailDto;
import my.compositeindex.app.engine.IndexEngine;
import my.compositeindex.app.engine.ResultSet;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.repository.ResultSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class IndexComputationServiceTest {
	private ResultSetRepository resultSetRepository;
	private WeightModelService weightModelService;
	private IndexEngine indexEngine;
	private IndexComputationService service;

	@BeforeEach
	void setUp() {
		resultSetRepository = mock(ResultSetRepository.class);
		weightModelService = mock(WeightModelService.class);
		indexEngine = mock(IndexEngine.class);
		AppProperties properties = new AppProperties(null, new AppProperties.Engine(0.85, 0.10, 100, 1), null);
		service = new IndexComputationService(resultSetRepository, weightModelService, indexEngine, properties);
	}

	@Test
	void computeStoresResultAndReportsCounts() {
		WeightModel model = mock(WeightModel.class);
		ResultSet result = ResultTableWriterTest.result();
		when(weightModelService.getModel("m1")).thenReturn(model);
		when(indexEngine.computeIndex(model, List.of("d1"), "Scores 2021")).thenReturn(result);

		ComputeResponseDto response = service.compute(new ComputeRequest("Scores 2021", "m1", List.of("d1")));

		assertThat(response.resultSetId()).isEqualTo("r1");
		assertThat(response.rowCount()).isEqualTo(2);
		assertThat(response.failedRowCount()).isZero();
		ArgumentCaptor<StoredResultSet> captor = ArgumentCaptor.forClass(StoredResultSet.class);
		verify(resultSetRepository).save(captor.capture());
		assertThat(captor.getValue().getResultId()).isEqualTo("r1");
		assertThat(captor.getValue().getWeightModelId()).isEqualTo("m1");
		assertThat(captor.getValue().getResult()).isSameAs(result);
	}

	@Test
	void detailCarriesPreviewOnly() {
		when(resultSetRepository.findById("r1")).thenReturn(Optional.of(StoredResultSet.of(ResultTableWriterTest.result())));

		ResultDetailDto detail = service.getResult("r1");

		assertThat(detail.rowCount()).isEqualTo(2);
		assertThat(detail.previewRows()).hasSize(1);
		assertThat(detail.columns()).containsExactlyElementsOf(ResultTableWriterTest.COLUMNS);
	}

	@Test
	void downloadIsNamedAfterResult() {
		when(resultSetRepository.findById("r1")).thenReturn(Optional.of(StoredResultSet.of(ResultTableWriterTest.result())));

		IndexComputationService.ResultDownload download = service.download("r1");

		assertThat(download.filename()).isEqualTo("Scores 2021.csv");
		assertThat(download.content()).startsWith("entity,year,score_raw,index_0_100");
	}

	@Test
	void unknownResultIsNotFound() {
		when(resultSetRepository.findById("nope")).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.getRows("nope")).isInstanceOf(NotFoundException.class);
	}
}
