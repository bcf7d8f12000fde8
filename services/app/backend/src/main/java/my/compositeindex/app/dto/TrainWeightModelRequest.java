package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import my.compositeindex.app.engine.WeightMethod;

import java.util.List;

/**
 * Data-driven training. AHP models are created through {@link AhpWeightModelRequest}.
 */
public record TrainWeightModelRequest(
		@NotBlank String name,
		@NotNull WeightMethod method,
		@NotEmpty List<String> indicatorKeys,
		@NotEmpty List<String> trainingDatasetIds,
		Double pcaCumVarThreshold
) {
}
