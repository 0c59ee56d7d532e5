package io.github.yok.sqlitevault.type;

/**
 * Raised when a decoded storage string cannot be read as its column's kind, which only happens for
 * values written around the gateway.
 *
 * @author Yasuharu.Okawauchi
 */
public class TypeConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TypeConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
