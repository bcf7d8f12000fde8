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
@Table(name = "mapping_templates")
public class MappingTemplate {
	@Id
	@Column(name = "name")
	private String name;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "map_json", nullable = false)
	private Map<String, String> columnsByIndicator = new LinkedHashMap<>();

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

	public Map<String, String> getColumnsByIndicator() {
		return columnsByIndicator;
	}

	public void setColumnsByIndicator(Map<String, String> columnsByIndicator) {
		this.columnsByIndicator = columnsByIndicator;
	}
}
