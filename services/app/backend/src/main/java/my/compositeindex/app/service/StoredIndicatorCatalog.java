package my.compositeindex.app.service;

import my.compositeindex.app.engine.IndicatorCatalog;
import my.compositeindex.app.engine.IndicatorDefinition;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class StoredIndicatorCatalog implements IndicatorCatalog {
	private final IndicatorService indicatorService;

	public StoredIndicatorCatalog(IndicatorService indicatorService) {
		this.indicatorService = indicatorService;
	}

	@Override
	public Optional<IndicatorDefinition> find(String key) {
		return indicatorService.findDefinition(key);
	}
}
