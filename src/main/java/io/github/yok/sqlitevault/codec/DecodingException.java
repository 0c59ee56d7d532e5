package io.github.yok.sqlitevault.codec;

/**
 * Raised when a stored value cannot be turned back into its logical text: bad Base64, a payload
 * that is not UTF-8, or a value sealed under a different secret.
 *
 * @author Yasuharu.Okawauchi
 */
public class DecodingException extends CodecException {

    private static final long serialVersionUID = 1L;

    public DecodingException(String message) {
        super(message);
    }

    public DecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
