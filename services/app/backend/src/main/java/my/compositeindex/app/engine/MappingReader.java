package my.compositeindex.app.engine;

public interface MappingReader {
	ColumnMapping read(String datasetId);
}
