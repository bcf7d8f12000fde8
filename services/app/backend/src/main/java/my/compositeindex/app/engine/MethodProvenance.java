package my.compositeindex.app.engine;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Method-specific diagnostics attached to a trained model, one variant per {@link WeightMethod}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "method")
@JsonSubTypes({
		@JsonSubTypes.Type(value = MethodProvenance.Entropy.class, name = "entropy"),
		@JsonSubTypes.Type(value = MethodProvenance.Pca.class, name = "pca"),
		@JsonSubTypes.Type(value = MethodProvenance.Ahp.class, name = "ahp")
})
public sealed interface MethodProvenance permits MethodProvenance.Entropy, MethodProvenance.Pca, MethodProvenance.Ahp {
	WeightMethod method();

	/**
	 * @param entropy    normalized entropy e_j per indicator
	 * @param divergence 1 - e_j per indicator
	 */
	record Entropy(Map<String, Double> entropy, Map<String, Double> divergence) implements MethodProvenance {
		public Entropy {
			entropy = Collections.unmodifiableMap(new LinkedHashMap<>(entropy));
			divergence = Collections.unmodifiableMap(new LinkedHashMap<>(divergence));
		}

		@Override
		public WeightMethod method() {
			return WeightMethod.ENTROPY;
		}
	}

	/**
	 * @param loadings           per indicator, its loading on each retained component
	 * @param eigenvalues        all eigenvalues, descending
	 * @param cumulativeVariance cumulative explained variance after each component
	 */
	record Pca(double threshold,
			   int componentsRetained,
			   List<Double> eigenvalues,
			   List<Double> cumulativeVariance,
			   Map<String, List<Double>> loadings) implements MethodProvenance {
		public Pca {
			eigenvalues = List.copyOf(eigenvalues);
			cumulativeVariance = List.copyOf(cumulativeVariance);
			loadings = Collections.unmodifiableMap(new LinkedHashMap<>(loadings));
		}

		@Override
		public WeightMethod method() {
			return WeightMethod.PCA;
		}
	}

	record Ahp(List<List<Double>> matrix,
			   Map<String, Double> priorityVector,
			   double lambdaMax,
			   double consistencyIndex,
			   double randomIndex,
			   double consistencyRatio,
			   double consistencyThreshold,
			   boolean consistent) implements MethodProvenance {
		public Ahp {
			matrix = matrix.stream().map(List::copyOf).toList();
			priorityVector = Collections.unmodifiableMap(new LinkedHashMap<>(priorityVector));
		}

		@Override
		public WeightMethod method() {
			return WeightMethod.AHP;
		}
	}
}
