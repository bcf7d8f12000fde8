package my.compositeindex.app.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal judgment matrix on Saaty's 1/9..9 scale. Reciprocity and the unit diagonal hold by
 * construction: setting {@code (i, j) = v} also sets {@code (j, i) = 1/v}, and pairs never
 * stated default to 1.
 */
public final class PairwiseComparisonMatrix {
	public static final double MIN_JUDGMENT = 1.0 / 9.0;
	public static final double MAX_JUDGMENT = 9.0;
	private static final double EPSILON = 1e-9;

	private final List<String> indicatorKeys;
	private final double[][] values;

	private PairwiseComparisonMatrix(List<String> indicatorKeys, double[][] values) {
		this.indicatorKeys = List.copyOf(indicatorKeys);
		this.values = values;
	}

	public static PairwiseComparisonMatrix of(List<String> indicatorKeys, List<Judgment> judgments) {
		if (indicatorKeys == null || indicatorKeys.isEmpty()) {
			throw new ValidationException("AHP needs at least one indicator");
		}
		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < indicatorKeys.size(); i++) {
			if (index.put(indicatorKeys.get(i), i) != null) {
				throw new ValidationException("Duplicate indicator key in AHP matrix: " + indicatorKeys.get(i));
			}
		}
		int n = indicatorKeys.size();
		double[][] values = new double[n][n];
		boolean[][] stated = new boolean[n][n];
		for (int i = 0; i < n; i++) {
			values[i][i] = 1.0;
			stated[i][i] = true;
		}
		for (Judgment judgment : judgments == null ? List.<Judgment>of() : judgments) {
			Integer row = index.get(judgment.row());
			Integer column = index.get(judgment.column());
			if (row == null || column == null) {
				throw new ValidationException("Judgment references an indicator outside the matrix: "
						+ judgment.row() + " / " + judgment.column());
			}
			double value = judgment.value();
			if (row.equals(column)) {
				if (Math.abs(value - 1.0) > EPSILON) {
					throw new ValidationException("Diagonal judgment for " + judgment.row() + " must be 1");
				}
				continue;
			}
			if (!Double.isFinite(value) || value < MIN_JUDGMENT - EPSILON || value > MAX_JUDGMENT + EPSILON) {
				throw new ValidationException("Judgment " + judgment.row() + " over " + judgment.column()
						+ " must be within [1/9, 9], got " + value);
			}
			if (stated[row][column] && Math.abs(values[row][column] - value) > EPSILON * Math.max(1.0, value)) {
				throw new ValidationException("Conflicting judgments for " + judgment.row() + " / " + judgment.column());
			}
			values[row][column] = value;
			values[column][row] = 1.0 / value;
			stated[row][column] = true;
			stated[column][row] = true;
		}
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				if (!stated[i][j]) {
					values[i][j] = 1.0;
				}
			}
		}
		return new PairwiseComparisonMatrix(indicatorKeys, values);
	}

	/**
	 * Builds the matrix from the strict upper triangle of a full square matrix; the lower triangle
	 * and diagonal are derived, not read.
	 */
	public static PairwiseComparisonMatrix fromUpperTriangle(List<String> indicatorKeys, List<List<Double>> matrix) {
		int n = indicatorKeys == null ? 0 : indicatorKeys.size();
		if (matrix == null || matrix.size() != n) {
			throw new ValidationException("AHP matrix must be " + n + "x" + n);
		}
		List<Judgment> judgments = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			List<Double> row = matrix.get(i);
			if (row == null || row.size() != n) {
				throw new ValidationException("AHP matrix must be " + n + "x" + n);
			}
			for (int j = i + 1; j < n; j++) {
				Double value = row.get(j);
				if (value == null) {
					continue;
				}
				judgments.add(new Judgment(indicatorKeys.get(i), indicatorKeys.get(j), value));
			}
		}
		return of(indicatorKeys, judgments);
	}

	public List<String> indicatorKeys() {
		return indicatorKeys;
	}

	public int size() {
		return indicatorKeys.size();
	}

	public double get(int row, int column) {
		return values[row][column];
	}

	public double[][] toArray() {
		double[][] copy = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			copy[i] = values[i].clone();
		}
		return copy;
	}

	public List<List<Double>> toList() {
		List<List<Double>> rows = new ArrayList<>(values.length);
		for (double[] row : values) {
			List<Double> list = new ArrayList<>(row.length);
			for (double x : row) {
				list.add(x);
			}
			rows.add(list);
		}
		return rows;
	}

	/**
	 * Importance of {@code row} over {@code column}.
	 */
	public record Judgment(String row, String column, double value) {
	}
}
