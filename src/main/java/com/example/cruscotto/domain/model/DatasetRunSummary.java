package com.example.cruscotto.domain.model;

import java.util.List;

/**
 * Per-dataset part of a {@link PipelineReport}. {@code error} is set when the dataset step failed
 * as a whole (for example when the table could not be written).
 */
public record DatasetRunSummary(
        int processed,
        int succeeded,
        int failed,
        int rowsPersisted,
        List<String> failedFiles,
        String error
) {

    public static DatasetRunSummary failure(String error) {
        return new DatasetRunSummary(0, 0, 0, 0, List.of(), error);
    }

    public boolean completed() {
        return error == null;
    }
}
