package io.github.yok.sqlitevault.codec;

/**
 * Base type for failures raised while encoding or decoding a stored value.
 *
 * <p>
 * Kept outside the gateway exception hierarchy so callers can tell a wrong secret or a tampered
 * value apart from a gateway contract violation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CodecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public CodecException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
