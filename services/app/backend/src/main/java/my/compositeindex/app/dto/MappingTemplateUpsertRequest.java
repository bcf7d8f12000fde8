package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record MappingTemplateUpsertRequest(@NotBlank String name, @NotNull Map<String, String> map) {
}
