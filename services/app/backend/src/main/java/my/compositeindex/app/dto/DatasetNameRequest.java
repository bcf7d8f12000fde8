package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;

public record DatasetNameRequest(@NotBlank String name) {
}
