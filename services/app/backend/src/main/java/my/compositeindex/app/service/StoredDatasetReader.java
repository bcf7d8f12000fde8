package my.compositeindex.app.service;

import my.compositeindex.app.domain.Dataset;
import my.compositeindex.app.engine.DatasetReader;
import my.compositeindex.app.engine.SourceTable;
import my.compositeindex.app.importer.DatasetCsvParser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class StoredDatasetReader implements DatasetReader {
	private final DatasetService datasetService;

	public StoredDatasetReader(DatasetService datasetService) {
		this.datasetService = datasetService;
	}

	@Override
	public SourceTable read(String datasetId) {
		Dataset dataset = datasetService.findDataset(datasetId);
		List<SourceTable.Row> rows = new ArrayList<>(dataset.getRows().size());
		for (Map<String, String> cells : dataset.getRows()) {
			// years are normalized to integers at import
			int year = Integer.parseInt(cells.get(DatasetCsvParser.YEAR_COLUMN));
			rows.add(new SourceTable.Row(cells.get(DatasetCsvParser.ENTITY_COLUMN), year, cells));
		}
		return new SourceTable(datasetId, dataset.getColumns(), rows);
	}
}
