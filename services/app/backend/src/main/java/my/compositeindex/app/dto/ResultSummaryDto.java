package my.compositeindex.app.dto;

import java.time.LocalDateTime;
import java.util.List;

public record ResultSummaryDto(String id,
							   String name,
							   LocalDateTime createdAt,
							   List<String> datasetIds,
							   String weightModelId,
							   int rowCount,
							   int failedRowCount,
							   List<String> columns) {
}
