package com.example.cruscotto.application.extraction;

import java.util.List;

/**
 * Text and table rows of the page an extractor works on.
 */
public record ReportPage(int index, String text, List<List<String>> rows) {

    public List<String> lines() {
        return text.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
    }
}
