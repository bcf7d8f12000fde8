package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import my.compositeindex.app.engine.Direction;

public record IndicatorDto(
		@NotBlank @Pattern(regexp = IndicatorDto.KEY_PATTERN) String key,
		@NotBlank String name,
		String dimension2Key,
		Direction direction,
		String unit
) {
	public static final String KEY_PATTERN = "^[a-zA-Z][a-zA-Z0-9_]*$";
}
