package com.example.cruscotto.infrastructure.pdf;

/**
 * Word extracted from the PDF with its horizontal extent.
 */
final class PositionedToken {
    private final float x;
    private final float endX;
    private final String text;

    PositionedToken(float x, float endX, String text) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.text = text == null ? "" : text;
    }

    float x() {
        return x;
    }

    float endX() {
        return endX;
    }

    String text() {
        return text;
    }
}
