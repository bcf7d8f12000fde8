package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ComputeRequest(String name, @NotBlank String weightModelId, @NotEmpty List<String> datasetIds) {
}
