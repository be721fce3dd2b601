package com.example.cruscotto.domain.model;

/**
 * Table schema of the accommodation page. Reports before the cutover publish a two-column
 * region/total table, later ones add the hotspot, reception centre and SIPROIMI/SAI breakdown.
 */
public enum AccommodationFormat {
    PRE_CUTOVER("pre-cutover"),
    POST_CUTOVER("post-cutover");

    private final String tag;

    AccommodationFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean hasBreakdownColumns() {
        return this == POST_CUTOVER;
    }

    public static AccommodationFormat fromTag(String tag) {
        for (AccommodationFormat format : values()) {
            if (format.tag.equalsIgnoreCase(tag)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown accommodation format: " + tag);
    }
}
