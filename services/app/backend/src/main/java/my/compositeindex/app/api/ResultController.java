package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.compositeindex.app.dto.ComputeRequest;
import my.compositeindex.app.dto.ComputeResponseDto;
import my.compositeindex.app.dto.ResultDetailDto;
import my.compositeindex.app.dto.ResultRowsDto;
import my.compositeindex.app.dto.ResultSummaryDto;
import my.compositeindex.app.service.IndexComputationService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Results")
public class ResultController {
	private final IndexComputationService computationService;

	public ResultController(IndexComputationService computationService) {
		this.computationService = computationService;
	}

	@PostMapping("/compute")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Apply a weight model to datasets and store the result set")
	public ComputeResponseDto compute(@Valid @RequestBody ComputeRequest request) {
		return computationService.compute(request);
	}

	@GetMapping("/results")
	@Operation(summary = "List result sets")
	public List<ResultSummaryDto> listResults() {
		return computationService.listResults();
	}

	@GetMapping("/results/{resultId}")
	@Operation(summary = "Get a result set with preview rows and row failures")
	public ResultDetailDto getResult(@PathVariable String resultId) {
		return computationService.getResult(resultId);
	}

	@GetMapping("/results/{resultId}/rows")
	@Operation(summary = "Get all rows of a result set")
	public ResultRowsDto getRows(@PathVariable String resultId) {
		return computationService.getRows(resultId);
	}

	@GetMapping("/results/{resultId}/download")
	@Operation(summary = "Download a result set as CSV")
	public ResponseEntity<byte[]> download(@PathVariable String resultId) {
		IndexComputationService.ResultDownload download = computationService.download(resultId);
		ContentDisposition disposition = ContentDisposition.attachment()
				.filename(download.filename(), StandardCharsets.UTF_8)
				.build();
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
				.contentType(MediaType.parseMediaType("text/csv"))
				.body(download.content().getBytes(StandardCharsets.UTF_8));
	}
}
