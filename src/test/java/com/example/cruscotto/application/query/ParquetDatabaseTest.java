package com.example.cruscotto.application.query;

import com.example.cruscotto.application.exception.InvalidQueryException;
import com.example.cruscotto.application.service.CsvExportService;
import com.example.cruscotto.domain.exception.TableNotFoundException;
import com.example.cruscotto.domain.model.DatabaseStats;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.LandingRecord;
import com.example.cruscotto.domain.model.NationalityRecord;
import com.example.cruscotto.domain.model.TableMetadata;
import com.example.cruscotto.domain.model.TemporalCoverage;
import com.example.cruscotto.infrastructure.parquet.ParquetTableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the query layer over real Parquet files in a temporary directory.
 */
class ParquetDatabaseTest {

    private static final LocalDate JAN = LocalDate.of(2024, 1, 31);
    private static final LocalDate FEB = LocalDate.of(2024, 2, 29);
    private static final LocalDate MAR = LocalDate.of(2024, 3, 31);

    @TempDir
    Path directory;

    private final ParquetTableStore store = new ParquetTableStore();
    private ParquetDatabase database;

    @BeforeEach
    void setUp() {
        database = new ParquetDatabase(directory, store, new CsvExportService());
        database.replaceTable(DatasetType.NATIONALITY, List.of(
                nationality("Tunisia", 100, JAN),
                nationality("Guinea", 50, JAN),
                nationality("Tunisia", 180, FEB),
                nationality("Egitto", 20, FEB),
                nationality("Tunisia", 260, MAR)));
        database.replaceTable(DatasetType.LANDINGS, List.of(
                new LandingRecord(1, 10, JAN, "jan.pdf").toRow(),
                new LandingRecord(2, 15, JAN, "jan.pdf").toRow(),
                new LandingRecord(1, 7, FEB, "feb.pdf").toRow()));
    }

    @Test
    void listsTablesByName() {
        assertThat(database.listTables()).containsExactly("landings", "nationality");
        assertThat(database.hasTable("nationality")).isTrue();
        assertThat(database.hasTable("accommodation")).isFalse();
    }

    @Test
    void dateRangeIsInclusiveOnBothEnds() {
        List<Map<String, Object>> rows = database.query("nationality", null, JAN, FEB, Map.of(), null);

        assertThat(rows).hasSize(4);
        assertThat(rows).extracting(row -> row.get("reference_date")).containsOnly("2024-01-31", "2024-02-29");
    }

    @Test
    void openEndedRangesKeepEverythingOnTheOpenSide() {
        assertThat(database.query("nationality", "reference_date", FEB, null, null, null)).hasSize(3);
        assertThat(database.query("nationality", "reference_date", null, JAN, null, null)).hasSize(2);
    }

    @Test
    void collectionFilterMeansMembershipAndScalarMeansEquality() {
        List<Map<String, Object>> members = database.query("nationality", null, null, null,
                Map.of("nationality", List.of("Guinea", "Egitto")), null);
        List<Map<String, Object>> exact = database.query("nationality", null, null, null,
                Map.of("landed_migrants", 180), null);

        assertThat(members).extracting(row -> row.get("nationality")).containsExactly("Guinea", "Egitto");
        assertThat(exact).singleElement().satisfies(row -> assertThat(row.get("reference_date")).isEqualTo("2024-02-29"));
    }

    @Test
    void unknownFilterColumnsAreIgnoredAndProjectionKeepsKnownColumns() {
        List<Map<String, Object>> rows = database.query("nationality", null, MAR, MAR,
                Map.of("region", "Lazio"), List.of("nationality", "missing", "landed_migrants"));

        assertThat(rows).containsExactly(Map.of("nationality", "Tunisia", "landed_migrants", 260));
        assertThat(rows.get(0).keySet()).containsExactly("nationality", "landed_migrants");
    }

    @Test
    void invalidQueriesAreRejected() {
        assertThatThrownBy(() -> database.query("nationality", "day", JAN, null, null, null))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("day");
        assertThatThrownBy(() -> database.query("nationality", null, MAR, JAN, null, null))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> database.query("arrivals", null, null, null, null, null))
                .isInstanceOf(TableNotFoundException.class)
                .hasMessage("Table not found: arrivals");
    }

    @Test
    void returnedRowsAreCopies() {
        List<Map<String, Object>> first = database.getTable("landings");
        first.get(0).put("landed_migrants", 9999);
        first.clear();

        assertThat(database.getTable("landings")).hasSize(3);
        assertThat(database.getTable("landings").get(0).get("landed_migrants")).isEqualTo(10);
    }

    @Test
    void temporalCoverageSumsMainMeasurePerMonth() {
        List<TemporalCoverage> coverage = database.getTemporalCoverage("landings");

        assertThat(coverage).containsExactly(
                new TemporalCoverage(2024, 1, 2, 25),
                new TemporalCoverage(2024, 2, 1, 7));
    }

    @Test
    void tableInfoAndStatsComeFromFooters() {
        TableMetadata info = database.getTableInfo("nationality");
        DatabaseStats stats = database.getDatabaseStats();

        assertThat(info.rowCount()).isEqualTo(5);
        assertThat(info.minReferenceDate()).isEqualTo("2024-01-31");
        assertThat(info.maxReferenceDate()).isEqualTo("2024-03-31");
        assertThat(stats.totalTables()).isEqualTo(2);
        assertThat(stats.totalRows()).isEqualTo(8);
        assertThat(stats.tables()).containsKeys("nationality", "landings");
        assertThatThrownBy(() -> database.getTableInfo("accommodation")).isInstanceOf(TableNotFoundException.class);
    }

    @Test
    void exportsCsvWithHeader() throws IOException {
        String csv = database.exportCsv("landings");
        Path target = directory.resolve("exports/landings.csv");
        database.exportToCsv("landings", target);

        assertThat(csv).startsWith("day,landed_migrants,reference_date,source_filename\n");
        assertThat(csv).contains("2,15,2024-01-31,jan.pdf");
        assertThat(Files.readString(target)).isEqualTo(csv);
    }

    @Test
    void refreshPicksUpTablesWrittenElsewhere() {
        assertThat(database.listTables()).doesNotContain("accommodation");
        store.write(directory, DatasetType.ACCOMMODATION, List.of());

        assertThat(database.listTables()).doesNotContain("accommodation");
        database.refresh();
        assertThat(database.listTables()).contains("accommodation");
    }

    @Test
    void missingDirectoryHasNoTables() {
        ParquetDatabase empty = new ParquetDatabase(directory.resolve("absent"), store, new CsvExportService());

        assertThat(empty.listTables()).isEmpty();
        assertThat(empty.getDatabaseStats().totalRows()).isZero();
    }

    private static Map<String, Object> nationality(String name, int landed, LocalDate date) {
        return new NationalityRecord(name, landed, date, date + ".pdf").toRow();
    }
}
