package io.github.yok.sqlitevault.core;

import lombok.Getter;

/**
 * Raised when {@code add} or {@code update} targets a table that does not exist.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableNotFoundException extends DataBaseException {

    private static final long serialVersionUID = 1L;

    // Name of the missing table
    private final String table;

    public TableNotFoundException(String table) {
        super("Table not found: " + table);
        this.table = table;
    }
}
