package io.github.yok.sqlitevault.core;

/**
 * Raised when {@code update} is called without any column to change.
 *
 * @author Yasuharu.Okawauchi
 */
public class EmptyUpdateException extends DataBaseException {

    private static final long serialVersionUID = 1L;

    public EmptyUpdateException(String table) {
        super("Empty data to replace in table " + table);
    }
}
