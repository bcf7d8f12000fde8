package my.compositeindex.app.importer;

public class DatasetImportException extends IllegalArgumentException {
	public DatasetImportException(String message) {
		super(message);
	}

	public DatasetImportException(String message, Throwable cause) {
		super(message, cause);
	}
}
