package com.example.cruscotto.application.service;

import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.config.CruscottoProperties.UrlOverride;
import com.example.cruscotto.domain.model.DownloadSummary;
import com.example.cruscotto.domain.model.ResolvedSource;
import com.example.cruscotto.domain.model.SourceDocument;
import com.example.cruscotto.infrastructure.http.HttpDocumentClient;
import com.example.cruscotto.infrastructure.http.HttpDocumentClient.FetchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for URL resolution and download behaviour, with the HTTP client mocked.
 */
class DocumentAcquirerTest {

    private static final byte[] PDF_BYTES = "%PDF-1.4 report".getBytes(StandardCharsets.US_ASCII);
    private static final FetchResponse NOT_FOUND = new FetchResponse(404, new byte[0]);

    @TempDir
    Path pdfDirectory;

    private HttpDocumentClient httpClient;
    private DocumentAcquirer acquirer;

    @BeforeEach
    void setUp() {
        CruscottoProperties properties = new CruscottoProperties();
        CruscottoProperties.Acquisition acquisition = properties.getAcquisition();
        acquisition.setBaseUrl("https://example.org/sites/default/files");
        acquisition.setDomain("https://example.org");
        acquisition.setPdfDirectory(pdfDirectory.toString());
        acquisition.setMaxRetries(2);
        acquisition.setRetryDelay(Duration.ZERO);
        acquisition.setTimeout(Duration.ofSeconds(5));

        UrlOverrideTable overrides = new UrlOverrideTable(List.of(
                new UrlOverride("2024-06", "/sites/default/files/2025-05/Cruscotto%20statistico%20al%2030%20giugno%202024.pdf")));
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneId.of("Europe/Rome"));
        httpClient = mock(HttpDocumentClient.class);
        acquirer = new DocumentAcquirer(properties, overrides, httpClient, clock);
    }

    @Test
    void resolveGeneratesVariantsForLastDayOfMonth() {
        ResolvedSource source = acquirer.resolve(2024, 2);

        assertThat(source.overrideUrl()).isEmpty();
        assertThat(source.folder()).isEqualTo("2025-05");
        assertThat(source.variantFilenames()).containsExactly(
                "Cruscotto statistico giornaliero 29-02-2024.pdf",
                "cruscotto_statistico_giornaliero_29-02-2024.pdf",
                "Cruscotto_statistico_giornaliero_29-02-2024.pdf",
                "cruscotto_statistico_giornaliero_29_2_2024.pdf");
    }

    @Test
    void resolveUsesOverrideWhenConfigured() {
        ResolvedSource source = acquirer.resolve(2024, 6);

        assertThat(source.overrideUrl())
                .contains("https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20al%2030%20giugno%202024.pdf");
    }

    @Test
    void storageFolderFollowsSiteReorganisation() {
        assertThat(DocumentAcquirer.storageFolder(2017, 1)).isEqualTo("2025-05");
        assertThat(DocumentAcquirer.storageFolder(2025, 5)).isEqualTo("2025-05");
        assertThat(DocumentAcquirer.storageFolder(2025, 6)).isEqualTo("2025-10");
        assertThat(DocumentAcquirer.storageFolder(2025, 10)).isEqualTo("2025-10");
        assertThat(DocumentAcquirer.storageFolder(2025, 11)).isEqualTo("2025-12");
        assertThat(DocumentAcquirer.storageFolder(2026, 3)).isEqualTo("2025-12");
    }

    @Test
    void fetchSkipsFilesAlreadyOnDisk() throws IOException {
        Files.write(pdfDirectory.resolve("existing.pdf"), PDF_BYTES);

        assertThat(acquirer.fetch("https://example.org/existing.pdf", "existing.pdf")).isTrue();
        verifyNoInteractions(httpClient);
    }

    @Test
    void fetchRetriesTransportFailures() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class)))
                .willThrow(new IOException("connection reset"))
                .willReturn(new FetchResponse(200, PDF_BYTES));

        assertThat(acquirer.fetch("https://example.org/a.pdf", "a.pdf")).isTrue();

        verify(httpClient, times(2)).get(eq("https://example.org/a.pdf"), any(Duration.class));
        assertThat(pdfDirectory.resolve("a.pdf")).hasBinaryContent(PDF_BYTES);
        try (Stream<Path> files = Files.list(pdfDirectory)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("a.pdf");
        }
    }

    @Test
    void fetchGivesUpAfterMaxRetries() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class))).willReturn(NOT_FOUND);

        assertThat(acquirer.fetch("https://example.org/missing.pdf", "missing.pdf")).isFalse();

        verify(httpClient, times(2)).get(anyString(), any(Duration.class));
        assertThat(pdfDirectory.resolve("missing.pdf")).doesNotExist();
    }

    @Test
    void fetchTreatsMalformedUrlAsFailureWithoutRetrying() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class)))
                .willThrow(new IllegalArgumentException("Illegal character in path"));

        assertThat(acquirer.fetch("https://example.org/bad path.pdf", "bad.pdf")).isFalse();

        verify(httpClient, times(1)).get(anyString(), any(Duration.class));
        assertThat(pdfDirectory.resolve("bad.pdf")).doesNotExist();
    }

    @Test
    void downloadRangeContinuesPastMalformedUrls() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class)))
                .willThrow(new IllegalArgumentException("Illegal character in path"));

        DownloadSummary summary = acquirer.downloadRange(2024, 1);

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(2);
    }

    @Test
    void processTwiceDownloadsAnExistingReportOnlyOnce() throws Exception {
        String url = "https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20giornaliero%2031-01-2024.pdf";
        given(httpClient.get(eq(url), any(Duration.class))).willReturn(new FetchResponse(200, PDF_BYTES));

        boolean first = acquirer.process(2024, 1);
        boolean second = acquirer.process(2024, 1);

        assertThat(first).isTrue();
        assertThat(second).isEqualTo(first);
        verify(httpClient, times(1)).get(anyString(), any(Duration.class));
        assertThat(acquirer.listDownloaded()).containsExactly("Cruscotto statistico giornaliero 31-01-2024.pdf");
    }

    @Test
    void processFallsBackThroughVariantsWithEncodedSpaces() throws Exception {
        String first = "https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20giornaliero%2031-01-2024.pdf";
        String second = "https://example.org/sites/default/files/2025-05/cruscotto_statistico_giornaliero_31-01-2024.pdf";
        given(httpClient.get(eq(first), any(Duration.class))).willReturn(NOT_FOUND);
        given(httpClient.get(eq(second), any(Duration.class))).willReturn(new FetchResponse(200, PDF_BYTES));

        assertThat(acquirer.process(2024, 1)).isTrue();

        assertThat(pdfDirectory.resolve("cruscotto_statistico_giornaliero_31-01-2024.pdf")).exists();
        verify(httpClient, never()).get(
                eq("https://example.org/sites/default/files/2025-05/Cruscotto_statistico_giornaliero_31-01-2024.pdf"),
                any(Duration.class));
    }

    @Test
    void acquireStoresOverrideUnderDecodedName() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class))).willReturn(new FetchResponse(200, PDF_BYTES));

        Optional<SourceDocument> document = acquirer.acquire(2024, 6);

        String url = "https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20al%2030%20giugno%202024.pdf";
        verify(httpClient).get(eq(url), any(Duration.class));
        assertThat(document).hasValueSatisfying(acquired -> {
            assertThat(acquired.period()).isEqualTo(YearMonth.of(2024, 6));
            assertThat(acquired.url()).isEqualTo(url);
            assertThat(acquired.localFilename()).isEqualTo("Cruscotto statistico al 30 giugno 2024.pdf");
            assertThat(acquired.localPath()).exists();
            assertThat(acquired.retrievedAt()).isEqualTo(Instant.parse("2024-03-15T10:00:00Z"));
        });
    }

    @Test
    void acquireIsEmptyWhenEveryCandidateFails() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class))).willReturn(NOT_FOUND);

        assertThat(acquirer.acquire(2024, 1)).isEmpty();
        verify(httpClient, times(8)).get(anyString(), any(Duration.class));
    }

    @Test
    void downloadRangeStopsBeforeCurrentMonth() throws Exception {
        given(httpClient.get(anyString(), any(Duration.class))).willReturn(NOT_FOUND);
        given(httpClient.get(eq("https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20giornaliero%2031-01-2024.pdf"),
                any(Duration.class))).willReturn(new FetchResponse(200, PDF_BYTES));

        DownloadSummary summary = acquirer.downloadRange(2023, 12);

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.success()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(2);
        verify(httpClient, never()).get(
                eq("https://example.org/sites/default/files/2025-05/Cruscotto%20statistico%20giornaliero%2031-03-2024.pdf"),
                any(Duration.class));
        assertThat(acquirer.listDownloaded()).containsExactly("Cruscotto statistico giornaliero 31-01-2024.pdf");
    }

    @Test
    void localFilenameDecodesLastSegment() {
        assertThat(DocumentAcquirer.localFilename("https://example.org/a/Cruscotto%20statistico%2031-01-2024.pdf?x=1"))
                .isEqualTo("Cruscotto statistico 31-01-2024.pdf");
        assertThat(DocumentAcquirer.localFilename("https://example.org/a/report+1.pdf")).isEqualTo("report+1.pdf");
    }
}
