package my.compositeindex.app.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

public record DatasetRowsDto(@NotEmpty List<String> columns, @NotNull List<Map<String, String>> rows) {
}
