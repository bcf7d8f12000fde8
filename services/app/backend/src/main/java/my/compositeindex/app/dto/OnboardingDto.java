package my.compositeindex.app.dto;

import java.util.Map;

public record OnboardingDto(String sampleDatasetId, Map<String, String> weightModelIds, Map<String, String> resultSetIds) {
}
