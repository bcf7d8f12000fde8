package my.compositeindex.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.compositeindex.app.engine.WeightMethod;
import my.compositeindex.app.engine.WeightModel;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted {@link WeightModel}. The model itself is stored whole as JSON; the scalar columns
 * exist for listing and reference checks.
 */
@Entity
@Table(name = "weight_models")
public class StoredWeightModel {
	@Id
	@Column(name = "model_id")
	private String modelId;

	@Column(name = "name", nullable = false)
	private String name;

	@Enumerated(EnumType.STRING)
	@Column(name = "method", nullable = false)
	private WeightMethod method;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "indicator_keys_json", nullable = false)
	private List<String> indicatorKeys = new ArrayList<>();

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "model_json", nullable = false)
	private WeightModel model;

	public static StoredWeightModel of(WeightModel model) {
		StoredWeightModel stored = new StoredWeightModel();
		stored.setModelId(model.id());
		stored.setName(model.name());
		stored.setMethod(model.method());
		stored.setCreatedAt(model.createdAt());
		stored.setIndicatorKeys(new ArrayList<>(model.indicatorKeys()));
		stored.setModel(model);
		return stored;
	}

	public String getModelId() {
		return modelId;
	}

	public void setModelId(String modelId) {
		this.modelId = modelId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public WeightMethod getMethod() {
		return method;
	}

	public void setMethod(WeightMethod method) {
		this.method = method;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public List<String> getIndicatorKeys() {
		return indicatorKeys;
	}

	public void setIndicatorKeys(List<String> indicatorKeys) {
		this.indicatorKeys = indicatorKeys;
	}

	public WeightModel getModel() {
		return model;
	}

	public void setModel(WeightModel model) {
		this.model = model;
	}
}
