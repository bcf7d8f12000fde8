package my.compositeindex.app.dto;

import my.compositeindex.app.engine.RowFailure;

import java.util.List;
import java.util.Map;

public record ResultRowsDto(List<String> columns, List<Map<String, Object>> rows, List<RowFailure> failures) {
}
