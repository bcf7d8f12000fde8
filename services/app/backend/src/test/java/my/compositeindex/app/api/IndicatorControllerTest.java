package my.compositeindex.app.api;

import my.compositeindex.app.dto.IndicatorDto;
import my.compositeindex.app.engine.Direction;
import my.compositeindex.app.service.IndicatorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IndicatorControllerTest {
	private IndicatorService indicatorService;
	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		indicatorService = mock(IndicatorService.class);
		mockMvc = MockMvcBuilders.standaloneSetup(new IndicatorController(indicatorService))
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void listsIndicators() throws Exception {
		when(indicatorService.listIndicators()).thenReturn(List.of(
				new IndicatorDto("debt", "Debt ratio", "solvency", Direction.NEGATIVE, "%")));

		mockMvc.perform(get("/api/indicators"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].key").value("debt"))
				.andExpect(jsonPath("$[0].dimension2Key").value("solvency"));
	}

	@Test
	void invalidKeyIsRejectedBeforeReachingTheService() throws Exception {
		mockMvc.perform(post("/api/indicators")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"key\":\"1bad\",\"name\":\"Bad\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));

		verify(indicatorService, never()).upsertIndicator(any());
	}

	@Test
	void malformedBodyIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/indicators")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{not json"))
				.andExpect(status().isBadRequest());
	}

	@Test
	void deletingIndicatorInUseIsConflict() throws Exception {
		doThrow(new IllegalStateException("Indicator 'gdp' is used by weight models"))
				.when(indicatorService).deleteIndicator("gdp");

		mockMvc.perform(delete("/api/indicators/gdp"))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.detail").value("Indicator 'gdp' is used by weight models"));
	}

	@Test
	void deleteReturnsOk() throws Exception {
		mockMvc.perform(delete("/api/indicators/gdp"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.ok").value(true));

		verify(indicatorService).deleteIndicator("gdp");
	}
}
