package com.example.cruscotto.infrastructure.pdf;

import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects every word of a page together with its position so that table rows can be rebuilt.
 */
final class TableRowStripper extends PDFTextStripper {
    private static final float Y_TOLERANCE = 1.5f;
    private final List<TableLine> lines = new ArrayList<>();

    TableRowStripper(int pageNumber) {
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        setSortByPosition(true);
        setShouldSeparateByBeads(true);
        setSuppressDuplicateOverlappingText(false);
    }

    List<TableLine> getLines() {
        lines.sort(Comparator.comparing(TableLine::y));
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty() && text != null && !text.isBlank()) {
            float tokenX = textPositions.stream()
                    .map(TextPosition::getXDirAdj)
                    .min(Float::compareTo)
                    .orElse(0f);
            float tokenEnd = textPositions.stream()
                    .map(position -> position.getXDirAdj() + position.getWidthDirAdj())
                    .max(Float::compareTo)
                    .orElse(tokenX);
            tokenEnd = Math.max(tokenEnd, tokenX + 0.5f);
            float tokenY = textPositions.stream()
                    .map(TextPosition::getYDirAdj)
                    .min(Float::compareTo)
                    .orElse(0f);
            resolveLine(tokenY).addToken(new PositionedToken(tokenX, tokenEnd, text));
        }
        super.writeString(text, textPositions);
    }

    private TableLine resolveLine(float y) {
        for (TableLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TableLine line = new TableLine(y);
        lines.add(line);
        return line;
    }
}
