package com.example.cruscotto.application.service;

import com.example.cruscotto.config.CruscottoProperties;
import com.example.cruscotto.domain.model.DownloadSummary;
import com.example.cruscotto.domain.model.ResolvedSource;
import com.example.cruscotto.domain.model.SourceDocument;
import com.example.cruscotto.infrastructure.http.HttpDocumentClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Application-layer service that locates and downloads the monthly reports.
 * <p>
 * A period is resolved to an optional override URL followed by generated filename variants inside
 * the storage folder the site used for that period. Files already on disk are never fetched again.
 */
@Service
public class DocumentAcquirer {

    private static final Logger log = LoggerFactory.getLogger(DocumentAcquirer.class);

    private final CruscottoProperties.Acquisition settings;
    private final UrlOverrideTable overrides;
    private final HttpDocumentClient httpClient;
    private final Clock clock;

    public DocumentAcquirer(CruscottoProperties properties,
                            UrlOverrideTable overrides,
                            HttpDocumentClient httpClient,
                            Clock clock) {
        this.settings = properties.getAcquisition();
        this.overrides = overrides;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /**
     * Computes every candidate location for one period without touching the network.
     *
     * @param year  report year
     * @param month report month, 1-12
     * @return override URL (when configured), storage folder and filename variants in try order
     */
    public ResolvedSource resolve(int year, int month) {
        YearMonth period = YearMonth.of(year, month);
        Optional<String> overrideUrl = overrides.pathFor(period).map(path -> settings.getDomain() + path);
        int day = period.lengthOfMonth();
        String dd = String.format("%02d", day);
        String mm = String.format("%02d", month);
        List<String> variants = List.of(
                "Cruscotto statistico giornaliero " + dd + "-" + mm + "-" + year + ".pdf",
                "cruscotto_statistico_giornaliero_" + dd + "-" + mm + "-" + year + ".pdf",
                "Cruscotto_statistico_giornaliero_" + dd + "-" + mm + "-" + year + ".pdf",
                "cruscotto_statistico_giornaliero_" + day + "_" + month + "_" + year + ".pdf"
        );
        return new ResolvedSource(period, overrideUrl, storageFolder(year, month), variants);
    }

    /**
     * Upload folder the site used for a period. Everything published before the 2025 reorganisation
     * was moved into {@code 2025-05}.
     */
    static String storageFolder(int year, int month) {
        if (year < 2025) {
            return "2025-05";
        }
        if (year == 2025) {
            if (month <= 5) {
                return "2025-05";
            }
            return month <= 10 ? "2025-10" : "2025-12";
        }
        return "2025-12";
    }

    /**
     * Downloads {@code url} into the PDF directory unless {@code targetName} is already there.
     *
     * @param url        absolute URL
     * @param targetName local filename
     * @return {@code true} when the file exists afterwards
     */
    public boolean fetch(String url, String targetName) {
        Path directory = pdfDirectory();
        Path target = directory.resolve(targetName);
        if (Files.exists(target)) {
            log.info("Already downloaded: {}", targetName);
            return true;
        }
        int attempts = Math.max(1, settings.getMaxRetries());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                HttpDocumentClient.FetchResponse response = httpClient.get(url, settings.getTimeout());
                if (response.successful()) {
                    write(directory, target, response.body());
                    log.info("Downloaded {} ({} bytes)", targetName, response.body().length);
                    return true;
                }
                log.debug("HTTP {} for {} (attempt {}/{})", response.status(), url, attempt, attempts);
            } catch (IOException ex) {
                log.warn("Attempt {}/{} failed for {}: {}", attempt, attempts, targetName, ex.getMessage());
            } catch (IllegalArgumentException ex) {
                log.warn("Malformed URL for {}: {}", targetName, ex.getMessage());
                return false;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Download of {} interrupted", targetName);
                return false;
            }
            if (attempt < attempts && !pause()) {
                return false;
            }
        }
        return false;
    }

    /**
     * Tries the override URL, then each generated variant, stopping at the first success.
     *
     * @return the report on disk, empty when no candidate location serves it
     */
    public Optional<SourceDocument> acquire(int year, int month) {
        ResolvedSource source = resolve(year, month);
        log.info("Processing period {}", source.period());
        if (source.overrideUrl().isPresent()) {
            String url = source.overrideUrl().get();
            String name = localFilename(url);
            if (fetch(url, name)) {
                return Optional.of(document(source, url, name));
            }
        }
        for (String variant : source.variantFilenames()) {
            String url = settings.getBaseUrl() + "/" + source.folder() + "/" + variant.replace(" ", "%20");
            if (fetch(url, variant)) {
                return Optional.of(document(source, url, variant));
            }
        }
        log.warn("No report found for {}", source.period());
        return Optional.empty();
    }

    /**
     * @return {@code true} when a report for the period is on disk
     */
    public boolean process(int year, int month) {
        return acquire(year, month).isPresent();
    }

    /**
     * Processes every month from the given start up to the last completed month. The current month
     * is never requested because its report is not published yet.
     */
    public DownloadSummary downloadRange(int startYear, int startMonth) {
        YearMonth start = YearMonth.of(startYear, startMonth);
        YearMonth end = YearMonth.now(clock).minusMonths(1);
        log.info("Downloading reports from {} to {}", start, end);
        int total = 0;
        int success = 0;
        for (YearMonth period = start; !period.isAfter(end); period = period.plusMonths(1)) {
            total++;
            if (process(period.getYear(), period.getMonthValue())) {
                success++;
            }
        }
        DownloadSummary summary = new DownloadSummary(total, success, total - success);
        log.info("Download summary: {} periods, {} downloaded, {} missing ({}%)",
                summary.total(), summary.success(), summary.failed(), String.format("%.1f", summary.successRate()));
        return summary;
    }

    public DownloadSummary downloadConfiguredRange() {
        return downloadRange(settings.getStartYear(), settings.getStartMonth());
    }

    /**
     * @return names of the PDF files in the download folder, sorted
     */
    public List<String> listDownloaded() {
        Path directory = pdfDirectory();
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.pdf")) {
            for (Path path : stream) {
                names.add(path.getFileName().toString());
            }
        } catch (IOException ex) {
            log.warn("Unable to list {}: {}", directory, ex.getMessage());
            return Collections.emptyList();
        }
        Collections.sort(names);
        return names;
    }

    public Path pdfDirectory() {
        return Paths.get(settings.getPdfDirectory());
    }

    /**
     * URL-decoded last path segment of {@code url}.
     */
    static String localFilename(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private SourceDocument document(ResolvedSource source, String url, String name) {
        return new SourceDocument(source.period(), url, pdfDirectory().resolve(name), clock.instant());
    }

    private void write(Path directory, Path target, byte[] body) throws IOException {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, ".download-", ".part");
        try {
            Files.write(temp, body);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private boolean pause() {
        long millis = settings.getRetryDelay().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Retry delay interrupted");
            return false;
        }
    }
}
