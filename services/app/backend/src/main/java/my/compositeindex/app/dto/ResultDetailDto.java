package my.compositeindex.app.dto;

import my.compositeindex.app.engine.RowFailure;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record ResultDetailDto(String id,
							  String name,
							  LocalDateTime createdAt,
							  List<String> datasetIds,
							  String weightModelId,
							  int rowCount,
							  int failedRowCount,
							  List<String> columns,
							  List<Map<String, Object>> previewRows,
							  List<RowFailure> failures) {
}
