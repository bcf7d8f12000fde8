package my.compositeindex.app.dto;

import java.util.Map;

public record MappingDto(String datasetId, Map<String, String> map) {
}
