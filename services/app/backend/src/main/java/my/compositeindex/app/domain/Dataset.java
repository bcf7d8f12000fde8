package my.compositeindex.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.compositeindex.app.model.DatasetSchema;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "datasets")
public class Dataset {
	@Id
	@Column(name = "dataset_id")
	private String datasetId;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Enumerated(EnumType.STRING)
	@Column(name = "source_type", nullable = false)
	private DatasetSourceType sourceType;

	@Column(name = "is_sample", nullable = false)
	private boolean sample;

	@Column(name = "row_count", nullable = false)
	private int rowCount;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "columns_json", nullable = false)
	private List<String> columns = new ArrayList<>();

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "rows_json", nullable = false)
	private List<Map<String, String>> rows = new ArrayList<>();

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "schema_json", nullable = false)
	private DatasetSchema schema;

	public String getDatasetId() {
		return datasetId;
	}

	public void setDatasetId(String datasetId) {
		this.datasetId = datasetId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public DatasetSourceType getSourceType() {
		return sourceType;
	}

	public void setSourceType(DatasetSourceType sourceType) {
		this.sourceType = sourceType;
	}

	public boolean isSample() {
		return sample;
	}

	public void setSample(boolean sample) {
		this.sample = sample;
	}

	public int getRowCount() {
		return rowCount;
	}

	public void setRowCount(int rowCount) {
		this.rowCount = rowCount;
	}

	public List<String> getColumns() {
		return columns;
	}

	public void setColumns(List<String> columns) {
		this.columns = columns;
	}

	public List<Map<String, String>> getRows() {
		return rows;
	}

	public void setRows(List<Map<String, String>> rows) {
		this.rows = rows;
	}

	public DatasetSchema getSchema() {
		return schema;
	}

	public void setSchema(DatasetSchema schema) {
		this.schema = schema;
	}
}
