package my.compositeindex.app.service;

import my.compositeindex.app.engine.ResultRow;
import my.compositeindex.app.engine.ResultSet;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultTableWriterTest {
	static final List<String> COLUMNS = List.of("entity", "year", "score_raw", "index_0_100",
			"sub_score_raw.economy", "subindex.economy_0_100", "raw.gdp");

	@Test
	void recordsFollowResultColumns() {
		List<Map<String, Object>> records = ResultTableWriter.records(result(), 10);

		assertThat(records).hasSize(2);
		assertThat(records.get(0).keySet()).containsExactlyElementsOf(COLUMNS);
		assertThat(records.get(0)).containsEntry("entity", "Ålesund, NO")
				.containsEntry("year", 2020)
				.containsEntry("subindex.economy_0_100", 25.0)
				.containsEntry("raw.gdp", 1.5);
	}

	@Test
	void recordsRespectLimit() {
		assertThat(ResultTableWriter.records(result(), 1)).hasSize(1);
	}

	@Test
	void csvQuotesCellsThatNeedIt() {
		String csv = ResultTableWriter.csv(result());

		assertThat(csv.split("\n")).containsExactly(
				String.join(",", COLUMNS),
				"\"Ålesund, NO\",2020,0.25,25.0,0.25,25.0,1.5",
				"B,2021,1.0,100.0,1.0,100.0,4.0");
	}

	static ResultSet result() {
		ResultRow first = new ResultRow("d1", "Ålesund, NO", 2020, 0.25, 25.0,
				Map.of("economy", 0.25), Map.of("economy", 25.0), Map.of("gdp", 1.5));
		ResultRow second = new ResultRow("d1", "B", 2021, 1.0, 100.0,
				Map.of("economy", 1.0), Map.of("economy", 100.0), Map.of("gdp", 4.0));
		return new ResultSet("r1", "Scores 2021", LocalDateTime.of(2024, 2, 1, 9, 0), List.of("d1"), "m1",
				COLUMNS, List.of(first, second), List.of());
	}
}
