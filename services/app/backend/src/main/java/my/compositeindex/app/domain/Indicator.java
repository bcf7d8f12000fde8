package my.compositeindex.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.compositeindex.app.engine.Direction;

import java.time.LocalDateTime;

@Entity
@Table(name = "indicators")
public class Indicator {
	@Id
	@Column(name = "indicator_key")
	private String key;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "dimension2_key", nullable = false)
	private String dimension2Key;

	@Enumerated(EnumType.STRING)
	@Column(name = "direction", nullable = false)
	private Direction direction;

	@Column(name = "unit")
	private String unit;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public String getKey() {
		return key;
	}

	public void setKey(String key) {
		this.key = key;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getDimension2Key() {
		return dimension2Key;
	}

	public void setDimension2Key(String dimension2Key) {
		this.dimension2Key = dimension2Key;
	}

	public Direction getDirection() {
		return direction;
	}

	public void setDirection(Direction direction) {
		this.direction = direction;
	}

	public String getUnit() {
		return unit;
	}

	public void setUnit(String unit) {
		this.unit = unit;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
