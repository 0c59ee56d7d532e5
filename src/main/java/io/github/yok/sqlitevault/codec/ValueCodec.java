package io.github.yok.sqlitevault.codec;

import io.github.yok.sqlitevault.config.DataMode;

/**
 * Encoding Provider contract.
 *
 * <p>
 * Turns a logical value into the string that is bound to SQLite, and a stored string back into the
 * logical value's text. Implementations are pure transforms over fixed configuration and are safe
 * to share between threads.
 * </p>
 *
 * <p>
 * {@code null} is never encoded: both directions return {@code null} unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ValueCodec {

    /**
     * Returns the data mode this codec implements.
     *
     * @return data mode
     */
    DataMode getMode();

    /**
     * Encodes a logical value for storage.
     *
     * @param value logical value, or {@code null}
     * @return storage string, or {@code null} when {@code value} is {@code null}
     * @throws CodecException if the value cannot be encoded in this mode
     */
    String encode(Object value);

    /**
     * Decodes a stored string back to the logical value's text.
     *
     * @param stored storage string, or {@code null}
     * @return decoded text, or {@code null} when {@code stored} is {@code null}
     * @throws DecodingException if {@code stored} was not produced by this codec and key
     */
    String decode(String stored);
}
