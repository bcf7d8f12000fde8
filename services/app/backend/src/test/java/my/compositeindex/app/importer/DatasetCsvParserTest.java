package my.compositeindex.app.importer;

import my.compositeindex.app.model.DatasetSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetCsvParserTest {
	private final DatasetCsvParser parser = new DatasetCsvParser();

	@Test
	void parsesCommaSeparatedDataAndInfersSchema() {
		String csv = "entity,year,gdp,region\n"
				+ " A , 2020 ,1.5,north\n"
				+ "B,2020.0,2,south\n";

		ParsedDataset parsed = parser.parse(csv, null);

		assertThat(parsed.columns()).containsExactly("entity", "year", "gdp", "region");
		assertThat(parsed.rows()).hasSize(2);
		assertThat(parsed.rows().get(0)).containsEntry("entity", "A").containsEntry("year", "2020");
		assertThat(parsed.rows().get(1)).containsEntry("year", "2020");
		DatasetSchema schema = parsed.schema();
		assertThat(schema.types()).containsEntry("year", DatasetSchema.TYPE_INT)
				.containsEntry("gdp", DatasetSchema.TYPE_NUMBER)
				.containsEntry("region", DatasetSchema.TYPE_STRING);
		assertThat(schema.rowCount()).isEqualTo(2);
		assertThat(schema.required()).containsExactly("entity", "year");
	}

	@Test
	void parsesSemicolonSeparatedDataWithBom() {
		String csv = "\uFEFFentity;year;gdp\nA;2021;3\nB;2021;\n";

		ParsedDataset parsed = parser.parse(csv, null);

		assertThat(parsed.rows()).hasSize(2);
		assertThat(parsed.rows().get(1)).containsEntry("gdp", "");
	}

	@Test
	void yearOverrideAddsYearColumnAfterEntity() {
		String csv = "gdp,entity\n1,A\n2,B\n";

		ParsedDataset parsed = parser.parse(csv, 2019);

		assertThat(parsed.columns()).containsExactly("entity", "year", "gdp");
		assertThat(parsed.rows()).allSatisfy(row -> assertThat(row).containsEntry("year", "2019"));
	}

	@Test
	void yearOverrideFillsOnlyBlankYears() {
		ParsedDataset parsed = parser.parse("entity,year\nA,\nB,2020\n", 2018);

		assertThat(parsed.rows()).extracting(row -> row.get("year")).containsExactly("2018", "2020");
	}

	@Test
	void missingYearWithoutOverrideIsRejected() {
		assertThatThrownBy(() -> parser.parse("entity,gdp\nA,1\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessageContaining("year");
	}

	@Test
	void missingEntityColumnIsRejected() {
		assertThatThrownBy(() -> parser.parse("name,year\nA,2020\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessageContaining("'entity'");
	}

	@Test
	void emptyInputIsRejected() {
		assertThatThrownBy(() -> parser.parse("  \n ", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessage("CSV is empty");
	}

	@Test
	void blankEntityAndBadYearReportTheLine() {
		assertThatThrownBy(() -> parser.parse("entity,year\nA,2020\n,2021\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessage("Row 3 has an empty entity");
		assertThatThrownBy(() -> parser.parse("entity,year\nA,twenty\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessageContaining("Row 2");
	}

	@Test
	void duplicateEntityYearPairsAreRejected() {
		assertThatThrownBy(() -> parser.parse("entity,year\nA,2020\nA,2020.0\nB,2020\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessageContaining("(A,2020)");
	}

	@Test
	void duplicateHeaderIsRejected() {
		assertThatThrownBy(() -> parser.parse("entity,year,gdp,gdp\nA,2020,1,2\n", null))
				.isInstanceOf(DatasetImportException.class)
				.hasMessageContaining("gdp");
	}

	@Test
	void normalizeAppliesRulesToEditedRows() {
		ParsedDataset parsed = parser.normalize(List.of("entity", "year", "gdp", " "),
				List.of(Map.of("entity", "A", "year", "2020", "gdp", "1")), null);

		assertThat(parsed.columns()).containsExactly("entity", "year", "gdp");
		assertThat(parsed.rows().get(0)).containsEntry("gdp", "1");
	}
}
