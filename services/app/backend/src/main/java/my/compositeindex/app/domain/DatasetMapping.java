package my.compositeindex.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "dataset_mappings")
public class DatasetMapping {
	@Id
	@Column(name = "dataset_id")
	private String datasetId;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "map_json", nullable = false)
	private Map<String, String> columnsByIndicator = new LinkedHashMap<>();

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public String getDatasetId() {
		return datasetId;
	}

	public void setDatasetId(String datasetId) {
		this.datasetId = datasetId;
	}

	public Map<String, String> getColumnsByIndicator() {
		return columnsByIndicator;
	}

	public void setColumnsByIndicator(Map<String, String> columnsByIndicator) {
		this.columnsByIndicator = columnsByIndicator;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
