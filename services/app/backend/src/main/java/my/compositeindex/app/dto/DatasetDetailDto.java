package my.compositeindex.app.dto;

import my.compositeindex.app.domain.DatasetSourceType;
import my.compositeindex.app.model.DatasetSchema;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record DatasetDetailDto(String id,
							   String name,
							   LocalDateTime createdAt,
							   DatasetSourceType sourceType,
							   boolean isSample,
							   int rowCount,
							   List<String> columns,
							   DatasetSchema schema,
							   List<Map<String, String>> previewRows) {
}
