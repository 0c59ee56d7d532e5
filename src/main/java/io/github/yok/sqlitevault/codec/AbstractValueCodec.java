package io.github.yok.sqlitevault.codec;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;

/**
 * Shared plumbing for {@link ValueCodec} implementations.
 *
 * <p>
 * Handles {@code null} pass-through, turns the logical value into text exactly once, and offers
 * strict Base64 and UTF-8 helpers so that every mode rejects malformed storage strings the same
 * way.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
abstract class AbstractValueCodec implements ValueCodec {

    // Standard alphabet, padded, no line breaks
    private static final Pattern BASE64_TEXT = Pattern.compile("[A-Za-z0-9+/]*={0,2}");
    // Rejects impossible trailing bits
    private static final Base64 STRICT_BASE64 = new Base64(0, null, false, CodecPolicy.STRICT);

    @Override
    public final String encode(Object value) {
        if (value == null) {
            return null;
        }
        return encodeText(stringify(value));
    }

    @Override
    public final String decode(String stored) {
        if (stored == null) {
            return null;
        }
        return decodeText(stored);
    }

    /**
     * Encodes the text form of a non-null logical value.
     *
     * @param text text form of the value
     * @return storage string
     */
    protected abstract String encodeText(String text);

    /**
     * Decodes a non-null storage string.
     *
     * @param stored storage string
     * @return logical text
     */
    protected abstract String decodeText(String stored);

    /**
     * Returns the text form written for a logical value.
     *
     * <p>
     * Decimal numbers are written without exponent notation and zoned date-times as ISO-8601
     * offset date-times, so the text reads back under every column kind that accepted the value.
     * </p>
     *
     * @param value non-null logical value
     * @return text form
     */
    static String stringify(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if ((value instanceof Double || value instanceof Float)
                && Double.isFinite(((Number) value).doubleValue())) {
            return new BigDecimal(value.toString()).toPlainString();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toOffsetDateTime().toString();
        }
        return value.toString();
    }

    /**
     * Wraps bytes as unchunked standard Base64.
     *
     * @param bytes raw bytes
     * @return Base64 text
     */
    static String toBase64(byte[] bytes) {
        return Base64.encodeBase64String(bytes);
    }

    /**
     * Unwraps standard Base64, rejecting anything outside the alphabet or badly padded.
     *
     * @param text Base64 text
     * @return raw bytes
     * @throws DecodingException if {@code text} is not valid Base64
     */
    static byte[] fromBase64(String text) {
        if (text.length() % 4 != 0 || !BASE64_TEXT.matcher(text).matches()) {
            throw new DecodingException("Stored value is not valid Base64");
        }
        try {
            return STRICT_BASE64.decode(text);
        } catch (IllegalArgumentException e) {
            throw new DecodingException("Stored value is not valid Base64", e);
        }
    }

    /**
     * Decodes bytes as UTF-8, failing on malformed sequences instead of substituting them.
     *
     * @param bytes raw bytes
     * @return decoded text
     * @throws DecodingException if {@code bytes} are not UTF-8
     */
    static String toUtf8Strict(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodingException("Stored value does not decode to UTF-8 text", e);
        }
    }
}
