package io.github.yok.sqlitevault.codec;

/**
 * Raised when the keyed stream transform is given an empty value to encode or decode.
 *
 * @author Yasuharu.Okawauchi
 */
public class EmptyInputException extends CodecException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
