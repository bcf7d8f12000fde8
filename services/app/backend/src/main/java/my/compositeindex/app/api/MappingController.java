package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.compositeindex.app.dto.MappingDto;
import my.compositeindex.app.dto.MappingTemplateDto;
import my.compositeindex.app.dto.MappingTemplateUpsertRequest;
import my.compositeindex.app.dto.MappingUpdateRequest;
import my.compositeindex.app.dto.StatusDto;
import my.compositeindex.app.service.MappingService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Mappings")
public class MappingController {
	private final MappingService mappingService;

	public MappingController(MappingService mappingService) {
		this.mappingService = mappingService;
	}

	@GetMapping("/mappings/{datasetId}")
	@Operation(summary = "Get the indicator-to-column mapping of a dataset")
	public MappingDto getMapping(@PathVariable String datasetId) {
		return mappingService.getMapping(datasetId);
	}

	@PutMapping("/mappings/{datasetId}")
	@Operation(summary = "Replace the indicator-to-column mapping of a dataset")
	public MappingDto putMapping(@PathVariable String datasetId, @Valid @RequestBody MappingUpdateRequest request) {
		return mappingService.putMapping(datasetId, request.map());
	}

	@PostMapping("/mappings/{datasetId}/apply-template/{name}")
	@Operation(summary = "Merge a mapping template into a dataset mapping")
	public MappingDto applyTemplate(@PathVariable String datasetId, @PathVariable String name) {
		return mappingService.applyTemplate(datasetId, name);
	}

	@GetMapping("/mapping-templates")
	@Operation(summary = "List mapping templates")
	public List<MappingTemplateDto> listTemplates() {
		return mappingService.listTemplates();
	}

	@PostMapping("/mapping-templates")
	@Operation(summary = "Create or update a mapping template")
	public MappingTemplateDto upsertTemplate(@Valid @RequestBody MappingTemplateUpsertRequest request) {
		return mappingService.upsertTemplate(request.name(), request.map());
	}

	@DeleteMapping("/mapping-templates/{name}")
	@Operation(summary = "Delete a mapping template")
	public StatusDto deleteTemplate(@PathVariable String name) {
		mappingService.deleteTemplate(name);
		return StatusDto.OK;
	}
}
