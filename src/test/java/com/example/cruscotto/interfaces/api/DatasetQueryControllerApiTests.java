package com.example.cruscotto.interfaces.api;

import com.example.cruscotto.application.exception.CsvExportValidationException;
import com.example.cruscotto.application.query.ParquetDatabase;
import com.example.cruscotto.application.service.PipelineService;
import com.example.cruscotto.domain.exception.TableNotFoundException;
import com.example.cruscotto.domain.model.DatasetRunSummary;
import com.example.cruscotto.domain.model.DatasetType;
import com.example.cruscotto.domain.model.DownloadSummary;
import com.example.cruscotto.domain.model.PipelineReport;
import com.example.cruscotto.domain.model.TemporalCoverage;
import com.example.cruscotto.infrastructure.exception.ColumnarStoreException;
import com.example.cruscotto.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = {DatasetQueryController.class, PipelineController.class})
@Import(GlobalExceptionHandler.class)
class DatasetQueryControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ParquetDatabase database;

    @MockBean
    private PipelineService pipelineService;

    @Test
    void listsTables() throws Exception {
        BDDMockito.given(database.listTables()).willReturn(List.of("landings", "nationality"));

        mockMvc.perform(get("/api/tables"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("landings"))
                .andExpect(jsonPath("$[1]").value("nationality"));
    }

    /**
     * Verifies that unknown tables translate to HTTP 404 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownTableMappedToNotFound() throws Exception {
        BDDMockito.given(database.getTableInfo("arrivals")).willThrow(new TableNotFoundException("arrivals"));

        mockMvc.perform(get("/api/tables/arrivals"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("TABLE_NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/tables/arrivals"))
                .andExpect(jsonPath("$.details.table").value("arrivals"));
    }

    /**
     * Verifies that reserved parameters drive the range and projection while every other parameter
     * becomes a filter, repeated ones as membership lists.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void rowsTranslateParametersIntoQuery() throws Exception {
        BDDMockito.given(database.query(any(), any(), any(), any(), anyMap(), any()))
                .willReturn(List.of(Map.of("nationality", "Tunisia", "landed_migrants", 100)));

        mockMvc.perform(get("/api/tables/nationality/rows")
                        .param("start", "2024-01-01")
                        .param("end", "2024-01-31")
                        .param("nationality", "Tunisia", "Guinea")
                        .param("source_filename", "jan.pdf")
                        .param("columns", "nationality, landed_migrants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].landed_migrants").value(100));

        verify(database).query(
                eq("nationality"),
                isNull(),
                eq(LocalDate.of(2024, 1, 1)),
                eq(LocalDate.of(2024, 1, 31)),
                eq(Map.of("nationality", List.of("Tunisia", "Guinea"), "source_filename", "jan.pdf")),
                eq(List.of("nationality", "landed_migrants")));
    }

    /**
     * Verifies that malformed dates translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void malformedDateMappedToBadRequest() throws Exception {
        mockMvc.perform(get("/api/tables/nationality/rows").param("start", "31/01/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value(containsString("start")));
    }

    @Test
    void coverageIsReturnedPerMonth() throws Exception {
        BDDMockito.given(database.getTemporalCoverage("landings"))
                .willReturn(List.of(new TemporalCoverage(2024, 1, 31, 1520)));

        mockMvc.perform(get("/api/tables/landings/coverage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].year").value(2024))
                .andExpect(jsonPath("$[0].total").value(1520));
    }

    @Test
    void exportReturnsCsvAttachment() throws Exception {
        BDDMockito.given(database.exportCsv("landings")).willReturn("day,landed_migrants\n1,10\n");

        mockMvc.perform(get("/api/tables/landings/export"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"landings.csv\""))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string("day,landed_migrants\n1,10\n"));
    }

    /**
     * Verifies that CSV export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void csvExportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(database.exportCsv("landings"))
                .willThrow(new CsvExportValidationException("No rows available for export."));

        mockMvc.perform(get("/api/tables/landings/export"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CSV_EXPORT_VALIDATION_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(database.getDatabaseStats())
                .willThrow(new ColumnarStoreException("Failed to scan data/parquet", new IOException("denied")));

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void pipelineRunReturnsReport() throws Exception {
        Map<DatasetType, DatasetRunSummary> datasets = new EnumMap<>(DatasetType.class);
        datasets.put(DatasetType.NATIONALITY, new DatasetRunSummary(12, 11, 1, 240, List.of("broken.pdf"), null));
        BDDMockito.given(pipelineService.runFull())
                .willReturn(new PipelineReport(new DownloadSummary(12, 12, 0), datasets));

        mockMvc.perform(post("/api/pipeline/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.download.success").value(12))
                .andExpect(jsonPath("$.datasets.NATIONALITY.rowsPersisted").value(240))
                .andExpect(jsonPath("$.datasets.NATIONALITY.failedFiles[0]").value("broken.pdf"));
    }
}
