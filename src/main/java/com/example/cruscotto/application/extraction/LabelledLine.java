package com.example.cruscotto.application.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A text line split into a leading label and the numeric-looking tokens that follow it,
 * e.g. {@code "Costa d'Avorio 1.234"} or {@code "Lombardia 12 3.456 789 4.257"}.
 */
record LabelledLine(String label, List<String> values) {

    static Optional<LabelledLine> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String[] tokens = line.strip().split("\\s+");
        int first = 0;
        while (first < tokens.length && !NumericCells.containsDigit(tokens[first])) {
            first++;
        }
        if (first == 0 || first == tokens.length) {
            return Optional.empty();
        }
        List<String> values = new ArrayList<>();
        for (int i = first; i < tokens.length; i++) {
            if (!NumericCells.containsDigit(tokens[i])) {
                return Optional.empty();
            }
            values.add(tokens[i]);
        }
        return Optional.of(new LabelledLine(String.join(" ", List.of(tokens).subList(0, first)), values));
    }
}
