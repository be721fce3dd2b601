package com.example.cruscotto.domain.model;

/**
 * Physical type of a canonical dataset column.
 */
public enum ColumnType {
    STRING,
    INT
}
