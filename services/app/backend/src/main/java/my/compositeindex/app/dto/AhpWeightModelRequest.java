package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import my.compositeindex.app.engine.StandardizationMethod;

import java.util.List;

/**
 * {@code matrix} is the full square judgment matrix in {@code indicatorKeys} order; only its
 * upper triangle is read. {@code standardizationDatasetIds} supply the population the
 * standardization parameters are fitted on.
 */
public record AhpWeightModelRequest(
		@NotBlank String name,
		@NotEmpty List<String> indicatorKeys,
		@NotEmpty List<String> standardizationDatasetIds,
		@NotEmpty List<List<Double>> matrix,
		StandardizationMethod standardizationMethod
) {
}
