package my.compositeindex.app.service;

import my.compositeindex.app.config.AppProperties;
import my.compositeindex.app.domain.Dataset;
import my.compositeindex.app.domain.DatasetSourceType;
import my.compositeindex.app.dto.DatasetDetailDto;
import my.compositeindex.app.dto.DatasetRowsDto;
import my.compositeindex.app.dto.DatasetSummaryDto;
import my.compositeindex.app.dto.ImportResultDto;
import my.compositeindex.app.dto.ImportTextRequest;
import my.compositeindex.app.importer.DatasetCsvParser;
import my.compositeindex.app.importer.DatasetImportException;
import my.compositeindex.app.importer.ParsedDataset;
import my.compositeindex.app.repository.DatasetRepository;
import my.compositeindex.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DatasetService {
	private static final Logger logger = LoggerFactory.getLogger(DatasetService.class);

	private final DatasetRepository datasetRepository;
	private final AppProperties properties;
	private final DatasetCsvParser parser;

	public DatasetService(DatasetRepository datasetRepository, AppProperties properties) {
		this.datasetRepository = datasetRepository;
		this.properties = properties;
		this.parser = new DatasetCsvParser();
	}

	public List<DatasetSummaryDto> listDatasets() {
		return datasetRepository.findAllOrderByCreatedAtDesc().stream()
				.map(this::toSummary)
				.toList();
	}

	public DatasetDetailDto getDataset(String datasetId) {
		Dataset dataset = findDataset(datasetId);
		List<Map<String, String>> rows = dataset.getRows();
		int limit = Math.min(rows.size(), properties.engine().previewRows());
		return new DatasetDetailDto(dataset.getDatasetId(), dataset.getName(), dataset.getCreatedAt(),
				dataset.getSourceType(), dataset.isSample(), dataset.getRowCount(), dataset.getColumns(),
				dataset.getSchema(), List.copyOf(rows.subList(0, limit)));
	}

	public DatasetRowsDto getRows(String datasetId) {
		Dataset dataset = findDataset(datasetId);
		return new DatasetRowsDto(dataset.getColumns(), dataset.getRows());
	}

	@Transactional
	public DatasetSummaryDto replaceRows(String datasetId, DatasetRowsDto request) {
		Dataset dataset = findDataset(datasetId);
		ParsedDataset parsed = parser.normalize(request.columns(), request.rows(), null);
		apply(dataset, parsed);
		datasetRepository.save(dataset);
		logger.info("Replaced rows of dataset {} ({} rows)", datasetId, parsed.rows().size());
		return toSummary(dataset);
	}

	@Transactional
	public DatasetSummaryDto rename(String datasetId, String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Dataset name must not be blank");
		}
		Dataset dataset = findDataset(datasetId);
		dataset.setName(name.trim());
		datasetRepository.save(dataset);
		return toSummary(dataset);
	}

	@Transactional
	public ImportResultDto importFile(MultipartFile file, String name, Integer yearOverride) {
		byte[] payload = readFile(file);
		ParsedDataset parsed = parser.parse(CsvParsing.decode(payload), yearOverride);
		String resolvedName = firstNonBlank(name, file.getOriginalFilename(), "Imported Dataset");
		Dataset dataset = createDataset(newId(), resolvedName, DatasetSourceType.FILE, parsed);
		return new ImportResultDto(dataset.getDatasetId(), dataset.getRowCount());
	}

	@Transactional
	public ImportResultDto importText(ImportTextRequest request) {
		ParsedDataset parsed = parser.parse(request.csvText(), request.yearOverride());
		String resolvedName = firstNonBlank(request.name(), null, "Pasted Dataset");
		Dataset dataset = createDataset(newId(), resolvedName, DatasetSourceType.PASTE, parsed);
		return new ImportResultDto(dataset.getDatasetId(), dataset.getRowCount());
	}

	public ParsedDataset parseCsv(String text, Integer yearOverride) {
		return parser.parse(text, yearOverride);
	}

	@Transactional
	public Dataset createDataset(String datasetId, String name, DatasetSourceType sourceType, ParsedDataset parsed) {
		Dataset dataset = new Dataset();
		dataset.setDatasetId(datasetId);
		dataset.setName(name);
		dataset.setSourceType(sourceType);
		dataset.setSample(sourceType == DatasetSourceType.SAMPLE);
		dataset.setCreatedAt(LocalDateTime.now());
		apply(dataset, parsed);
		Dataset saved = datasetRepository.save(dataset);
		logger.info("Imported dataset {} '{}' from {} ({} rows, {} columns)", datasetId, name,
				sourceType.value(), parsed.rows().size(), parsed.columns().size());
		return saved;
	}

	public Dataset findDataset(String datasetId) {
		return datasetRepository.findById(datasetId)
				.orElseThrow(() -> new NotFoundException("Dataset not found: " + datasetId));
	}

	private void apply(Dataset dataset, ParsedDataset parsed) {
		dataset.setColumns(new ArrayList<>(parsed.columns()));
		dataset.setRows(new ArrayList<>(parsed.rows()));
		dataset.setSchema(parsed.schema());
		dataset.setRowCount(parsed.rows().size());
	}

	private DatasetSummaryDto toSummary(Dataset dataset) {
		return new DatasetSummaryDto(dataset.getDatasetId(), dataset.getName(), dataset.getCreatedAt(),
				dataset.getSourceType(), dataset.isSample(), dataset.getRowCount(), dataset.getColumns());
	}

	private byte[] readFile(MultipartFile file) {
		if (file == null) {
			throw new DatasetImportException("File is required");
		}
		try {
			byte[] payload = file.getBytes();
			if (payload.length == 0) {
				throw new DatasetImportException("File is empty");
			}
			return payload;
		} catch (IOException exc) {
			throw new DatasetImportException("Failed to read upload: " + exc.getMessage(), exc);
		}
	}

	private static String firstNonBlank(String first, String second, String fallback) {
		if (first != null && !first.isBlank()) {
			return first.trim();
		}
		if (second != null && !second.isBlank()) {
			return second.trim();
		}
		return fallback;
	}

	static String newId() {
		return UUID.randomUUID().toString().replace("-", "");
	}
}
