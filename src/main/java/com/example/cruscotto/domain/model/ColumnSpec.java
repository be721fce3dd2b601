package com.example.cruscotto.domain.model;

/**
 * Name and type of one column of a canonical dataset.
 */
public record ColumnSpec(String name, ColumnType type) {

    public static ColumnSpec string(String name) {
        return new ColumnSpec(name, ColumnType.STRING);
    }

    public static ColumnSpec integer(String name) {
        return new ColumnSpec(name, ColumnType.INT);
    }

    public boolean numeric() {
        return type == ColumnType.INT;
    }
}
