package my.compositeindex.app.service;

import my.compositeindex.app.engine.ColumnMapping;
import my.compositeindex.app.engine.MappingReader;
import org.springframework.stereotype.Component;

@Component
public class StoredMappingReader implements MappingReader {
	private final MappingService mappingService;

	public StoredMappingReader(MappingService mappingService) {
		this.mappingService = mappingService;
	}

	@Override
	public ColumnMapping read(String datasetId) {
		return mappingService.columnMapping(datasetId);
	}
}
