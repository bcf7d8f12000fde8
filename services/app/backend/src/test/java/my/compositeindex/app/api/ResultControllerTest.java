package my.compositeindex.app.api;

import my.compositeindex.app.engine.InsufficientObservationsException;
import my.compositeindex.app.engine.NonConvergentEigenDecompositionException;
import my.compositeindex.app.service.IndexComputationService;
import my.compositeindex.app.service.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ResultControllerTest {
	private IndexComputationService computationService;
	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		computationService = mock(IndexComputationService.class);
		mockMvc = MockMvcBuilders.standaloneSetup(new ResultController(computationService))
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void downloadIsCsvAttachment() throws Exception {
		when(computationService.download("r1"))
				.thenReturn(new IndexComputationService.ResultDownload("result_r1.csv", "entity,year\nA,2020\n"));

		mockMvc.perform(get("/api/results/r1/download"))
				.andExpect(status().isOk())
				.andExpect(content().contentTypeCompatibleWith("text/csv"))
				.andExpect(header().string("Content-Disposition", containsString("attachment")))
				.andExpect(header().string("Content-Disposition", containsString("result_r1.csv")))
				.andExpect(content().string("entity,year\nA,2020\n"));
	}

	@Test
	void unknownResultIsNotFound() throws Exception {
		when(computationService.getResult("missing")).thenThrow(new NotFoundException("Result not found: missing"));

		mockMvc.perform(get("/api/results/missing"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.detail").value("Result not found: missing"));
	}

	@Test
	void computeWithoutDatasetsFailsValidation() throws Exception {
		mockMvc.perform(post("/api/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"weightModelId\":\"m1\",\"datasetIds\":[]}"))
				.andExpect(status().isBadRequest());

		verify(computationService, never()).compute(any());
	}

	@Test
	void dataQualityProblemIsUnprocessable() throws Exception {
		when(computationService.compute(any()))
				.thenThrow(new InsufficientObservationsException("No complete observations"));

		mockMvc.perform(post("/api/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"weightModelId\":\"m1\",\"datasetIds\":[\"d1\"]}"))
				.andExpect(status().is(422));
	}

	@Test
	void numericalFailureIsServerError() throws Exception {
		when(computationService.compute(any()))
				.thenThrow(new NonConvergentEigenDecompositionException("Eigen decomposition did not converge", 100));

		mockMvc.perform(post("/api/compute")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"weightModelId\":\"m1\",\"datasetIds\":[\"d1\"]}"))
				.andExpect(status().isInternalServerError())
				.andExpect(jsonPath("$.title").value("Numerical failure"));
	}
}
