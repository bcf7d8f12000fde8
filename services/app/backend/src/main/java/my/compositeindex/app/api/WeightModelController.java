package my.compositeindex.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.compositeindex.app.dto.AhpWeightModelRequest;
import my.compositeindex.app.dto.TrainWeightModelRequest;
import my.compositeindex.app.engine.WeightModel;
import my.compositeindex.app.service.WeightModelService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/weight-models")
@Tag(name = "Weight Models")
public class WeightModelController {
	private final WeightModelService weightModelService;

	public WeightModelController(WeightModelService weightModelService) {
		this.weightModelService = weightModelService;
	}

	@GetMapping
	@Operation(summary = "List weight models")
	public List<WeightModel> listModels() {
		return weightModelService.listModels();
	}

	@GetMapping("/{modelId}")
	@Operation(summary = "Get a weight model with its provenance")
	public WeightModel getModel(@PathVariable String modelId) {
		return weightModelService.getModel(modelId);
	}

	@PostMapping("/train")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Train an entropy or PCA weight model")
	public WeightModel train(@Valid @RequestBody TrainWeightModelRequest request) {
		return weightModelService.train(request);
	}

	@PostMapping("/ahp")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Create an AHP weight model from a pairwise judgment matrix")
	public WeightModel createAhp(@Valid @RequestBody AhpWeightModelRequest request) {
		return weightModelService.trainAhp(request);
	}
}
