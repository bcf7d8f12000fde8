package my.compositeindex.app.dto;

import java.time.LocalDateTime;
import java.util.Map;

public record MappingTemplateDto(String name, LocalDateTime createdAt, Map<String, String> map) {
}
