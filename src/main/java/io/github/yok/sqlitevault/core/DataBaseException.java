package io.github.yok.sqlitevault.core;

/**
 * Base type for gateway contract violations that cannot be answered with a negative-status
 * {@link DatabaseResponse}.
 *
 * @author Yasuharu.Okawauchi
 */
public class DataBaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DataBaseException(String message) {
        super(message);
    }
}
