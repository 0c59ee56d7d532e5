package io.github.yok.sqlitevault.codec;

/**
 * Raised when a value contains characters the active codec cannot represent.
 *
 * <p>
 * Only the keyed stream transform has such a limit: a character whose shifted code point lands in
 * the surrogate block or beyond U+10FFFF cannot be stored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class UnencodableValueException extends CodecException {

    private static final long serialVersionUID = 1L;

    public UnencodableValueException(String message) {
        super(message);
    }
}
