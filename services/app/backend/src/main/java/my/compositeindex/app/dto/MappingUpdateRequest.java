package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record MappingUpdateRequest(@NotNull Map<String, String> map) {
}
