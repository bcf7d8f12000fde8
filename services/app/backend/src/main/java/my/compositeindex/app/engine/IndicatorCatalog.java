package my.compositeindex.app.engine;

import java.util.Optional;

public interface IndicatorCatalog {
	Optional<IndicatorDefinition> find(String key);
}
