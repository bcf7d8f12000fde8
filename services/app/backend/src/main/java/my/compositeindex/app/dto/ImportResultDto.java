package my.compositeindex.app.dto;

public record ImportResultDto(String datasetId, int rowCount) {
}
