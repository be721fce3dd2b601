package com.example.cruscotto.domain.model;

import java.util.List;

/**
 * Records and per-document outcome of one pass over the downloaded reports.
 */
public record ExtractionBatch<R extends DatasetRecord>(
        DatasetType dataset,
        List<R> records,
        List<String> processedFiles,
        List<String> failedFiles
) {

    public int succeeded() {
        return processedFiles.size() - failedFiles.size();
    }
}
