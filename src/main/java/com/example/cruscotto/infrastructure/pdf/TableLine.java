package com.example.cruscotto.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tokens sharing one baseline, ordered left to right.
 */
final class TableLine {
    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();
    private boolean sorted = false;

    TableLine(float y) {
        this.y = y;
    }

    void addToken(PositionedToken token) {
        if (token == null) {
            return;
        }
        tokens.add(token);
        sorted = false;
    }

    List<PositionedToken> tokens() {
        if (!sorted) {
            tokens.sort(Comparator.comparing(PositionedToken::x));
            sorted = true;
        }
        return tokens;
    }

    float y() {
        return y;
    }

    String text() {
        return tokens().stream()
                .map(PositionedToken::text)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }

    /**
     * Groups tokens into cells. A gap wider than {@code cellGap} between the end of one token and the
     * start of the next opens a new cell.
     *
     * @param cellGap minimum gap in PDF points
     * @return cell texts, left to right
     */
    List<String> cells(float cellGap) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        float previousEnd = Float.NaN;
        for (PositionedToken token : tokens()) {
            String text = token.text().trim();
            if (text.isEmpty()) {
                continue;
            }
            if (!Float.isNaN(previousEnd) && token.x() - previousEnd > cellGap) {
                cells.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(text);
            previousEnd = token.endX();
        }
        if (current.length() > 0) {
            cells.add(current.toString());
        }
        return cells;
    }
}
