package com.example.cruscotto.application.extraction;

import java.util.regex.Pattern;

/**
 * Parsing of numeric cells as printed in the reports ({@code 1.234}, {@code 12 345}, {@code 7*}).
 */
final class NumericCells {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("\\d{1,3}(?:[.\\s]\\d{3})*|\\d+");

    private NumericCells() {
    }

    static boolean containsDigit(String cell) {
        if (cell == null) {
            return false;
        }
        for (int i = 0; i < cell.length(); i++) {
            if (Character.isDigit(cell.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    static boolean isNumericToken(String token) {
        return token != null && NUMERIC_TOKEN.matcher(token.trim()).matches();
    }

    /**
     * Keeps the digits of {@code cell} and parses them. Cells without digits, or with more digits
     * than an int holds, become zero.
     */
    static int parse(String cell) {
        if (cell == null) {
            return 0;
        }
        String digits = NON_DIGITS.matcher(cell).replaceAll("");
        if (digits.isEmpty() || digits.length() > 9) {
            return 0;
        }
        return Integer.parseInt(digits);
    }

    static String squeeze(String cell) {
        return cell == null ? "" : cell.strip().replaceAll("\\s+", " ");
    }
}
