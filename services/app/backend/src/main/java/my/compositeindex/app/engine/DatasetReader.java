package my.compositeindex.app.engine;

public interface DatasetReader {
	SourceTable read(String datasetId);
}
