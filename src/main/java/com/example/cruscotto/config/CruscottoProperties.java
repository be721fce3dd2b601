package com.example.cruscotto.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings bound from the {@code cruscotto} prefix of {@code application.yml}.
 */
@ConfigurationProperties(prefix = "cruscotto")
public class CruscottoProperties {

    private Acquisition acquisition = new Acquisition();
    private Extraction extraction = new Extraction();
    private Storage storage = new Storage();
    private Pipeline pipeline = new Pipeline();

    public Acquisition getAcquisition() {
        return acquisition;
    }

    public void setAcquisition(Acquisition acquisition) {
        this.acquisition = acquisition;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Where reports are published and how they are fetched.
     */
    public static class Acquisition {
        private String baseUrl = "https://libertaciviliimmigrazione.dlci.interno.gov.it/sites/default/files";
        private String domain = "https://libertaciviliimmigrazione.dlci.interno.gov.it";
        private String pdfDirectory = "data/pdfs";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private int startYear = 2017;
        private int startMonth = 1;
        private List<UrlOverride> overrides = new ArrayList<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public String getPdfDirectory() {
            return pdfDirectory;
        }

        public void setPdfDirectory(String pdfDirectory) {
            this.pdfDirectory = pdfDirectory;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public int getStartYear() {
            return startYear;
        }

        public void setStartYear(int startYear) {
            this.startYear = startYear;
        }

        public int getStartMonth() {
            return startMonth;
        }

        public void setStartMonth(int startMonth) {
            this.startMonth = startMonth;
        }

        public List<UrlOverride> getOverrides() {
            return overrides;
        }

        public void setOverrides(List<UrlOverride> overrides) {
            this.overrides = overrides;
        }
    }

    /**
     * Known exception to the generated URL scheme. {@code period} is {@code yyyy-MM}, {@code path}
     * is relative to the acquisition domain and already URL-encoded.
     */
    public static class UrlOverride {
        private String period;
        private String path;

        public UrlOverride() {
        }

        public UrlOverride(String period, String path) {
            this.period = period;
            this.path = path;
        }

        public String getPeriod() {
            return period;
        }

        public void setPeriod(String period) {
            this.period = period;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Extraction {
        private LocalDate accommodationCutover = LocalDate.of(2019, 6, 1);
        private float cellGap = 8f;

        public LocalDate getAccommodationCutover() {
            return accommodationCutover;
        }

        public void setAccommodationCutover(LocalDate accommodationCutover) {
            this.accommodationCutover = accommodationCutover;
        }

        /**
         * @return minimum horizontal gap, in PDF points, that separates two table cells
         */
        public float getCellGap() {
            return cellGap;
        }

        public void setCellGap(float cellGap) {
            this.cellGap = cellGap;
        }
    }

    public static class Storage {
        private String outputDirectory = "data/parquet";

        public String getOutputDirectory() {
            return outputDirectory;
        }

        public void setOutputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
        }
    }

    public static class Pipeline {
        private boolean runOnStartup = false;
        private String cron = "0 0 3 5 * *";
        private int updateWindowMonths = 3;

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public int getUpdateWindowMonths() {
            return updateWindowMonths;
        }

        public void setUpdateWindowMonths(int updateWindowMonths) {
            this.updateWindowMonths = updateWindowMonths;
        }
    }
}
