package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;

public record ImportTextRequest(String name, @NotBlank String csvText, Integer yearOverride) {
}
