package com.example.cruscotto.application.extraction;

import com.example.cruscotto.domain.model.DatasetRecord;

import java.util.List;

/**
 * One way of reading records off a located page. Strategies never validate; they return whatever
 * they could parse, possibly nothing.
 */
public interface ExtractionStrategy<R extends DatasetRecord> {

    String name();

    List<R> extract(ReportPage page, ExtractionContext context);
}
