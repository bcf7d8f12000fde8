package my.compositeindex.app.dto;

public record ComputeResponseDto(String resultSetId, int rowCount, int failedRowCount) {
}
