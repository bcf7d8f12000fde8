package my.compositeindex.app.dto;

import my.compositeindex.app.domain.DatasetSourceType;

import java.time.LocalDateTime;
import java.util.List;

public record DatasetSummaryDto(String id,
								String name,
								LocalDateTime createdAt,
								DatasetSourceType sourceType,
								boolean isSample,
								int rowCount,
								List<String> columns) {
}
