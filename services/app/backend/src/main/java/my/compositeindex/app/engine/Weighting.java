package my.compositeindex.app.engine;

/**
 * Raw output of a weighter: weights aligned with the input column order plus diagnostics.
 */
public record Weighting(double[] weights, MethodProvenance provenance) {
}
