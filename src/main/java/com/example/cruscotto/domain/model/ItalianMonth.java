package com.example.cruscotto.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Italian month names as they appear in report filenames, titles and chart axis labels.
 */
public enum ItalianMonth {
    GENNAIO("gennaio", "gen"),
    FEBBRAIO("febbraio", "feb"),
    MARZO("marzo", "mar"),
    APRILE("aprile", "apr"),
    MAGGIO("maggio", "mag"),
    GIUGNO("giugno", "giu"),
    LUGLIO("luglio", "lug"),
    AGOSTO("agosto", "ago"),
    SETTEMBRE("settembre", "set"),
    OTTOBRE("ottobre", "ott"),
    NOVEMBRE("novembre", "nov"),
    DICEMBRE("dicembre", "dic");

    private final String fullName;
    private final String abbreviation;

    ItalianMonth(String fullName, String abbreviation) {
        this.fullName = fullName;
        this.abbreviation = abbreviation;
    }

    public String fullName() {
        return fullName;
    }

    public String abbreviation() {
        return abbreviation;
    }

    /**
     * @return calendar month number, 1 for January
     */
    public int number() {
        return ordinal() + 1;
    }

    public static ItalianMonth of(int month) {
        return values()[month - 1];
    }

    /**
     * Case-insensitive lookup by full month name.
     *
     * @param name candidate word
     * @return matching month, empty when the word is not a month name
     */
    public static Optional<ItalianMonth> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ItalianMonth month : values()) {
            if (month.fullName.equals(normalized)) {
                return Optional.of(month);
            }
        }
        return Optional.empty();
    }
}
