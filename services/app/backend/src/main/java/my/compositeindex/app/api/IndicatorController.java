package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.compositeindex.app.dto.IndicatorDto;
import my.compositeindex.app.dto.StatusDto;
import my.compositeindex.app.service.IndicatorService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/indicators")
@Tag(name = "Indicators")
public class IndicatorController {
	private final IndicatorService indicatorService;

	public IndicatorController(IndicatorService indicatorService) {
		this.indicatorService = indicatorService;
	}

	@GetMapping
	@Operation(summary = "List indicators")
	public List<IndicatorDto> listIndicators() {
		return indicatorService.listIndicators();
	}

	@PostMapping
	@Operation(summary = "Create or update an indicator")
	public IndicatorDto upsertIndicator(@Valid @RequestBody IndicatorDto request) {
		return indicatorService.upsertIndicator(request);
	}

	@DeleteMapping("/{key}")
	@Operation(summary = "Delete an indicator not used by any weight model")
	public StatusDto deleteIndicator(@PathVariable String key) {
		indicatorService.deleteIndicator(key);
		return StatusDto.OK;
	}
}
