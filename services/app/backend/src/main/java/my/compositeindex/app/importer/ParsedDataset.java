package my.compositeindex.app.importer;

import my.compositeindex.app.model.DatasetSchema;

import java.util.List;
import java.util.Map;

public record ParsedDataset(List<String> columns, List<Map<String, String>> rows, DatasetSchema schema) {
}
