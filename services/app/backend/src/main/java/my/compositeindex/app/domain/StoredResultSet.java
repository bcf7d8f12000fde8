package my.compositeindex.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.compositeindex.app.engine.ResultSet;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

@Entity
@Table(name = "result_sets")
public class StoredResultSet {
	@Id
	@Column(name = "result_id")
	private String resultId;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "weight_model_id", nullable = false)
	private String weightModelId;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "row_count", nullable = false)
	private int rowCount;

	@Column(name = "failed_row_count", nullable = false)
	private int failedRowCount;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "result_json", nullable = false)
	private ResultSet result;

	public static StoredResultSet of(ResultSet result) {
		StoredResultSet stored = new StoredResultSet();
		stored.setResultId(result.id());
		stored.setName(result.name());
		stored.setWeightModelId(result.weightModelId());
		stored.setCreatedAt(result.createdAt());
		stored.setRowCount(result.rowCount());
		stored.setFailedRowCount(result.failedRowCount());
		stored.setResult(result);
		return stored;
	}

	public String getResultId() {
		return resultId;
	}

	public void setResultId(String resultId) {
		this.resultId = resultId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getWeightModelId() {
		return weightModelId;
	}

	public void setWeightModelId(String weightModelId) {
		this.weightModelId = weightModelId;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public int getRowCount() {
		return rowCount;
	}

	public void setRowCount(int rowCount) {
		this.rowCount = rowCount;
	}

	public int getFailedRowCount() {
		return failedRowCount;
	}

	public void setFailedRowCount(int failedRowCount) {
		this.failedRowCount = failedRowCount;
	}

	public ResultSet getResult() {
		return result;
	}

	public void setResult(ResultSet result) {
		this.result = result;
	}
}
