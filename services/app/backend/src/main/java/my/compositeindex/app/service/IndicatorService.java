package my.compositeindex.app.service;

import my.compositeindex.app.domain.DatasetMapping;
import my.compositeindex.app.domain.Indicator;
import my.compositeindex.app.domain.StoredWeightModel;
import my.compositeindex.app.dto.IndicatorDto;
import my.compositeindex.app.engine.Direction;
import my.compositeindex.app.engine.IndicatorDefinition;
import my.compositeindex.app.repository.DatasetMappingRepository;
import my.compositeindex.app.repository.IndicatorRepository;
import my.compositeindex.app.repository.WeightModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Indicator catalog. Once a persisted weight model references an indicator, its direction and
 * dimension are frozen and it cannot be deleted; name and unit stay editable.
 */
@Service
public class IndicatorService {
	private static final Logger logger = LoggerFactory.getLogger(IndicatorService.class);
	private static final Pattern KEY_PATTERN = Pattern.compile(IndicatorDto.KEY_PATTERN);

	private final IndicatorRepository indicatorRepository;
	private final WeightModelRepository weightModelRepository;
	private final DatasetMappingRepository mappingRepository;

	public IndicatorService(IndicatorRepository indicatorRepository,
							WeightModelRepository weightModelRepository,
							DatasetMappingRepository mappingRepository) {
		this.indicatorRepository = indicatorRepository;
		this.weightModelRepository = weightModelRepository;
		this.mappingRepository = mappingRepository;
	}

	public List<IndicatorDto> listIndicators() {
		return indicatorRepository.findAllOrderByKey().stream()
				.map(this::toDto)
				.toList();
	}

	public Optional<IndicatorDefinition> findDefinition(String key) {
		return indicatorRepository.findById(key)
				.map(i -> new IndicatorDefinition(i.getKey(), i.getDimension2Key(), i.getDirection()));
	}

	@Transactional
	public IndicatorDto upsertIndicator(IndicatorDto request) {
		String key = request.key() == null ? "" : request.key().trim();
		if (!KEY_PATTERN.matcher(key).matches()) {
			throw new IllegalArgumentException("Indicator key must match " + IndicatorDto.KEY_PATTERN + ": " + request.key());
		}
		if (request.name() == null || request.name().isBlank()) {
			throw new IllegalArgumentException("Indicator name must not be blank");
		}
		String dimension = request.dimension2Key() == null || request.dimension2Key().isBlank()
				? IndicatorDefinition.DEFAULT_DIMENSION
				: request.dimension2Key().trim();
		Direction direction = request.direction() == null ? Direction.POSITIVE : request.direction();

		Indicator indicator = indicatorRepository.findById(key).orElse(null);
		if (indicator == null) {
			indicator = new Indicator();
			indicator.setKey(key);
		} else if (!Objects.equals(indicator.getDirection(), direction)
				|| !Objects.equals(indicator.getDimension2Key(), dimension)) {
			List<String> models = referencingModelIds(key);
			if (!models.isEmpty()) {
				throw new IllegalStateException("Indicator " + key + " is used by weight model(s) " + models
						+ "; its direction and dimension2Key cannot change");
			}
		}
		indicator.setName(request.name().trim());
		indicator.setDimension2Key(dimension);
		indicator.setDirection(direction);
		indicator.setUnit(request.unit() == null || request.unit().isBlank() ? null : request.unit().trim());
		indicator.setUpdatedAt(LocalDateTime.now());
		indicatorRepository.save(indicator);
		return toDto(indicator);
	}

	@Transactional
	public void deleteIndicator(String key) {
		if (!indicatorRepository.existsById(key)) {
			return;
		}
		List<String> models = referencingModelIds(key);
		if (!models.isEmpty()) {
			throw new IllegalStateException("Indicator " + key + " is used by weight model(s) " + models
					+ " and cannot be deleted");
		}
		indicatorRepository.deleteById(key);
		for (DatasetMapping mapping : mappingRepository.findAll()) {
			if (mapping.getColumnsByIndicator().containsKey(key)) {
				Map<String, String> columns = new LinkedHashMap<>(mapping.getColumnsByIndicator());
				columns.remove(key);
				mapping.setColumnsByIndicator(columns);
				mapping.setUpdatedAt(LocalDateTime.now());
				mappingRepository.save(mapping);
			}
		}
		logger.info("Deleted indicator {}", key);
	}

	List<String> referencingModelIds(String key) {
		return weightModelRepository.findAll().stream()
				.filter(model -> model.getIndicatorKeys() != null && model.getIndicatorKeys().contains(key))
				.map(StoredWeightModel::getModelId)
				.sorted()
				.toList();
	}

	private IndicatorDto toDto(Indicator indicator) {
		return new IndicatorDto(indicator.getKey(), indicator.getName(), indicator.getDimension2Key(),
				indicator.getDirection(), indicator.getUnit());
	}
}
