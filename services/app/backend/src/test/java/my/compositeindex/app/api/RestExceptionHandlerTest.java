package my.compositeindex.app.api;

import my.compositeindex.app.engine.DegenerateIndicatorException;
import my.compositeindex.app.engine.MissingMappingException;
import my.compositeindex.app.engine.NonConvergentEigenDecompositionException;
import my.compositeindex.app.engine.ValidationException;
import my.compositeindex.app.service.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class RestExceptionHandlerTest {
	private final RestExceptionHandler handler = new RestExceptionHandler();
	private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/weight-models/train");

	@Test
	void degenerateIndicatorCarriesKey() {
		ProblemDetail detail = handler.handleDataQuality(
				new DegenerateIndicatorException("gdp", "Indicator 'gdp' has zero variance"), request);

		assertThat(detail.getStatus()).isEqualTo(422);
		assertThat(detail.getDetail()).isEqualTo("Indicator 'gdp' has zero variance");
		assertThat(detail.getType().toString()).isEqualTo("about:blank");
		assertThat(detail.getProperties())
				.containsEntry("errorType", "DegenerateIndicatorException")
				.containsEntry("indicatorKey", "gdp")
				.containsEntry("path", "/api/weight-models/train");
	}

	@Test
	void otherDataQualityProblemsHaveNoKey() {
		ProblemDetail detail = handler.handleDataQuality(new MissingMappingException("No mapping for gdp"), request);

		assertThat(detail.getProperties())
				.containsEntry("errorType", "MissingMappingException")
				.doesNotContainKey("indicatorKey");
	}

	@Test
	void nonConvergenceReportsIterations() {
		ProblemDetail detail = handler.handleNumerical(
				new NonConvergentEigenDecompositionException("Jacobi did not converge", 100), request);

		assertThat(detail.getStatus()).isEqualTo(500);
		assertThat(detail.getTitle()).isEqualTo("Numerical failure");
		assertThat(detail.getProperties()).containsEntry("iterations", 100);
	}

	@Test
	void validationAndNotFoundMapToClientErrors() {
		assertThat(handler.handleBadRequest(new ValidationException("bad"), request).getStatus()).isEqualTo(400);
		assertThat(handler.handleNotFound(new NotFoundException("gone"), request).getStatus()).isEqualTo(404);
		assertThat(handler.handleConflict(new IllegalStateException("in use"), request).getStatus()).isEqualTo(409);
	}

	@Test
	void unexpectedErrorsHideTheMessage() {
		ProblemDetail detail = handler.handleUnhandled(new RuntimeException("secret internals"), request);

		assertThat(detail.getStatus()).isEqualTo(500);
		assertThat(detail.getDetail()).isEqualTo("Unexpected error");
	}
}
