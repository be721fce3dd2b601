package com.example.cruscotto.domain.exception;

/**
 * Raised when a query names a table that the columnar store does not hold.
 */
public class TableNotFoundException extends DomainException {

    private final String tableName;

	/**
	 * @param tableName requested table name
	 */
    public TableNotFoundException(String tableName) {
        super("Table not found: " + tableName);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
