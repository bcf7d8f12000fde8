package my.compositeindex.app.service;

import my.compositeindex.app.domain.Dataset;
import my.compositeindex.app.domain.DatasetMapping;
import my.compositeindex.app.domain.MappingTemplate;
import my.compositeindex.app.dto.MappingDto;
import my.compositeindex.app.dto.MappingTemplateDto;
import my.compositeindex.app.engine.ColumnMapping;
import my.compositeindex.app.repository.DatasetMappingRepository;
import my.compositeindex.app.repository.IndicatorRepository;
import my.compositeindex.app.repository.MappingTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-dataset indicator-to-column mappings and reusable named templates.
 */
@Service
public class MappingService {
	private static final Logger logger = LoggerFactory.getLogger(MappingService.class);

	private final DatasetMappingRepository mappingRepository;
	private final MappingTemplateRepository templateRepository;
	private final IndicatorRepository indicatorRepository;
	private final DatasetService datasetService;

	public MappingService(DatasetMappingRepository mappingRepository,
						  MappingTemplateRepository templateRepository,
						  IndicatorRepository indicatorRepository,
						  DatasetService datasetService) {
		this.mappingRepository = mappingRepository;
		this.templateRepository = templateRepository;
		this.indicatorRepository = indicatorRepository;
		this.datasetService = datasetService;
	}

	public MappingDto getMapping(String datasetId) {
		datasetService.findDataset(datasetId);
		return new MappingDto(datasetId, currentMap(datasetId));
	}

	/**
	 * Engine view of a mapping; a dataset without a stored mapping maps nothing.
	 */
	public ColumnMapping columnMapping(String datasetId) {
		return new ColumnMapping(datasetId, currentMap(datasetId));
	}

	@Transactional
	public MappingDto putMapping(String datasetId, Map<String, String> map) {
		datasetService.findDataset(datasetId);
		Map<String, String> cleaned = clean(map);
		List<String> unknown = cleaned.keySet().stream()
				.filter(key -> !indicatorRepository.existsById(key))
				.toList();
		if (!unknown.isEmpty()) {
			throw new IllegalArgumentException("Mapping references unknown indicators: " + unknown);
		}
		DatasetMapping mapping = mappingRepository.findById(datasetId).orElseGet(() -> {
			DatasetMapping created = new DatasetMapping();
			created.setDatasetId(datasetId);
			return created;
		});
		mapping.setColumnsByIndicator(cleaned);
		mapping.setUpdatedAt(LocalDateTime.now());
		mappingRepository.save(mapping);
		return new MappingDto(datasetId, cleaned);
	}

	public List<MappingTemplateDto> listTemplates() {
		return templateRepository.findAllOrderByCreatedAtDesc().stream()
				.map(this::toDto)
				.toList();
	}

	@Transactional
	public MappingTemplateDto upsertTemplate(String name, Map<String, String> map) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Template name must not be blank");
		}
		String normalizedName = name.trim();
		MappingTemplate template = templateRepository.findById(normalizedName).orElseGet(() -> {
			MappingTemplate created = new MappingTemplate();
			created.setName(normalizedName);
			created.setCreatedAt(LocalDateTime.now());
			return created;
		});
		template.setColumnsByIndicator(clean(map));
		templateRepository.save(template);
		return toDto(template);
	}

	@Transactional
	public void deleteTemplate(String name) {
		if (templateRepository.existsById(name)) {
			templateRepository.deleteById(name);
		}
	}

	/**
	 * Copies the template entries whose column exists in the dataset over the current mapping.
	 */
	@Transactional
	public MappingDto applyTemplate(String datasetId, String templateName) {
		Dataset dataset = datasetService.findDataset(datasetId);
		MappingTemplate template = templateRepository.findById(templateName)
				.orElseThrow(() -> new NotFoundException("Mapping template not found: " + templateName));
		Map<String, String> merged = new LinkedHashMap<>(currentMap(datasetId));
		List<String> skipped = new ArrayList<>();
		for (Map.Entry<String, String> entry : template.getColumnsByIndicator().entrySet()) {
			if (!dataset.getColumns().contains(entry.getValue())) {
				skipped.add(entry.getKey());
				continue;
			}
			if (indicatorRepository.existsById(entry.getKey())) {
				merged.put(entry.getKey(), entry.getValue());
			} else {
				skipped.add(entry.getKey());
			}
		}
		if (!skipped.isEmpty()) {
			logger.info("Template '{}' applied to dataset {}; skipped {}", templateName, datasetId, skipped);
		}
		return putMapping(datasetId, merged);
	}

	private Map<String, String> currentMap(String datasetId) {
		return mappingRepository.findById(datasetId)
				.map(mapping -> (Map<String, String>) new LinkedHashMap<>(mapping.getColumnsByIndicator()))
				.orElseGet(LinkedHashMap::new);
	}

	private Map<String, String> clean(Map<String, String> map) {
		Map<String, String> cleaned = new LinkedHashMap<>();
		if (map == null) {
			return cleaned;
		}
		map.forEach((key, column) -> {
			if (key != null && !key.isBlank() && column != null && !column.isBlank()) {
				cleaned.put(key.trim(), column.trim());
			}
		});
		return cleaned;
	}

	private MappingTemplateDto toDto(MappingTemplate template) {
		return new MappingTemplateDto(template.getName(), template.getCreatedAt(), template.getColumnsByIndicator());
	}
}
