package com.example.cruscotto.domain.model;

import java.util.Map;

/**
 * Outcome of a pipeline run: the download summary (absent when no download ran) and the
 * extraction summary per dataset.
 */
public record PipelineReport(
        DownloadSummary download,
        Map<DatasetType, DatasetRunSummary> datasets
) {
}
