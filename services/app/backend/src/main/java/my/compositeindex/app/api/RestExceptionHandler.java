package my.compositeindex.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.compositeindex.app.engine.DataQualityException;
import my.compositeindex.app.engine.DegenerateIndicatorException;
import my.compositeindex.app.engine.NonConvergentEigenDecompositionException;
import my.compositeindex.app.engine.NumericalException;
import my.compositeindex.app.engine.ValidationException;
import my.compositeindex.app.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler({ValidationException.class, IllegalArgumentException.class})
	public ProblemDetail handleBadRequest(RuntimeException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(NotFoundException.class)
	public ProblemDetail handleNotFound(NotFoundException ex, HttpServletRequest request) {
		logger.warn("Not found on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
	}

	@ExceptionHandler(DataQualityException.class)
	public ProblemDetail handleDataQuality(DataQualityException ex, HttpServletRequest request) {
		logger.warn("Data quality problem on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Data quality problem", ex.getMessage(), request);
		detail.setProperty("errorType", ex.getClass().getSimpleName());
		if (ex instanceof DegenerateIndicatorException degenerate && degenerate.getIndicatorKey() != null) {
			detail.setProperty("indicatorKey", degenerate.getIndicatorKey());
		}
		return detail;
	}

	@ExceptionHandler(NumericalException.class)
	public ProblemDetail handleNumerical(NumericalException ex, HttpServletRequest request) {
		logger.error("Numerical failure on {}", request.getRequestURI(), ex);
		ProblemDetail detail = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Numerical failure", ex.getMessage(), request);
		if (ex instanceof NonConvergentEigenDecompositionException nonConvergent) {
			detail.setProperty("iterations", nonConvergent.getIterations());
		}
		return detail;
	}

	@ExceptionHandler(IllegalStateException.class)
	public ProblemDetail handleConflict(IllegalStateException ex, HttpServletRequest request) {
		logger.warn("Conflict on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body.", request);
	}

	@ExceptionHandler(MaxUploadSizeExceededException.class)
	public ProblemDetail handleMaxUpload(MaxUploadSizeExceededException ex, HttpServletRequest request) {
		logger.warn("Upload too large on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.CONTENT_TOO_LARGE, "Payload Too Large", "Upload exceeded the maximum allowed size.", request);
	}

	@ExceptionHandler(MultipartException.class)
	public ProblemDetail handleMultipart(MultipartException ex, HttpServletRequest request) {
		logger.warn("Multipart request failed on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Invalid multipart request", "Failed to read multipart request.", request);
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private ProblemDetail problem(HttpStatus status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
