package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.compositeindex.app.dto.DatasetDetailDto;
import my.compositeindex.app.dto.DatasetNameRequest;
import my.compositeindex.app.dto.DatasetRowsDto;
import my.compositeindex.app.dto.DatasetSummaryDto;
import my.compositeindex.app.dto.ImportResultDto;
import my.compositeindex.app.dto.ImportTextRequest;
import my.compositeindex.app.service.DatasetService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/datasets")
@Tag(name = "Datasets")
public class DatasetController {
	private final DatasetService datasetService;

	public DatasetController(DatasetService datasetService) {
		this.datasetService = datasetService;
	}

	@GetMapping
	@Operation(summary = "List datasets")
	public List<DatasetSummaryDto> listDatasets() {
		return datasetService.listDatasets();
	}

	@GetMapping("/{datasetId}")
	@Operation(summary = "Get dataset with schema and preview rows")
	public DatasetDetailDto getDataset(@PathVariable String datasetId) {
		return datasetService.getDataset(datasetId);
	}

	@GetMapping("/{datasetId}/data")
	@Operation(summary = "Get all dataset rows")
	public DatasetRowsDto getRows(@PathVariable String datasetId) {
		return datasetService.getRows(datasetId);
	}

	@PutMapping("/{datasetId}/data")
	@Operation(summary = "Replace dataset rows")
	public DatasetSummaryDto replaceRows(@PathVariable String datasetId, @Valid @RequestBody DatasetRowsDto request) {
		return datasetService.replaceRows(datasetId, request);
	}

	@PutMapping("/{datasetId}/name")
	@Operation(summary = "Rename dataset")
	public DatasetSummaryDto rename(@PathVariable String datasetId, @Valid @RequestBody DatasetNameRequest request) {
		return datasetService.rename(datasetId, request.name());
	}

	@PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Import a CSV file")
	public ImportResultDto importFile(@RequestParam("file") MultipartFile file,
									  @RequestParam(value = "name", required = false) String name,
									  @RequestParam(value = "yearOverride", required = false) Integer yearOverride) {
		return datasetService.importFile(file, name, yearOverride);
	}

	@PostMapping("/import-text")
	@Operation(summary = "Import pasted CSV text")
	public ImportResultDto importText(@Valid @RequestBody ImportTextRequest request) {
		return datasetService.importText(request);
	}
}
