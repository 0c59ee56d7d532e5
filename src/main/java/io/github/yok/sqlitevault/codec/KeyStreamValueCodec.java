package io.github.yok.sqlitevault.codec;

import io.github.yok.sqlitevault.config.DataMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Codec for {@link DataMode#SECURE}: a keyed, reversible stream transform.
 *
 * <p>
 * <strong>This is not cryptographic-strength encryption.</strong> It has no nonce, reuses the same
 * key stream for every value and can be broken with modest effort. Use {@link AesGcmValueCodec}
 * when confidentiality matters.
 * </p>
 *
 * <p>
 * Transform:
 * </p>
 * <ol>
 * <li>The key stream is the SHA-512 hex digest of the secret, extended by appending its own
 * reverse until it is at least as long as the value, then cut to the value's length (in code
 * points).</li>
 * <li>Each code point becomes {@code plain + 27 * key}.</li>
 * <li>The result is UTF-8 encoded and wrapped in Base64.</li>
 * <li>A 64-bit HMAC-SHA256 tag of the plain text is appended after a {@code ':'}.</li>
 * </ol>
 *
 * <p>
 * The transform is deterministic, so equality predicates can be matched against encoded values.
 * Decoding under a different secret fails with {@link DecodingException}, either because the
 * subtraction leaves the code point range or because the tag does not match.
 * </p>
 *
 * <p>
 * Not every text can be encoded. The shift adds up to {@code 27 * 'f'} (2754) to each code
 * point, so characters from about U+CD3E upwards, such as the upper Hangul syllables, may land in
 * the surrogate block and are refused with {@link UnencodableValueException}. Which characters
 * are refused depends on the secret and the character's position.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class KeyStreamValueCodec extends AbstractValueCodec {

    static final int MULTIPLIER = 27;
    static final char TAG_SEPARATOR = ':';
    private static final int TAG_HEX_LENGTH = 16;
    private static final String WRONG_KEY =
            "Stored value was not produced under the configured secret or has been altered";

    private final SecretKeyMaterial keyMaterial;

    /**
     * Creates a codec bound to the given key material.
     *
     * @param keyMaterial derived key material
     */
    public KeyStreamValueCodec(SecretKeyMaterial keyMaterial) {
        this.keyMaterial = Validate.notNull(keyMaterial, "keyMaterial must not be null");
    }

    @Override
    public DataMode getMode() {
        return DataMode.SECURE;
    }

    @Override
    protected String encodeText(String text) {
        if (text.isEmpty()) {
            throw new EmptyInputException("Secure mode cannot encode an empty value");
        }
        int[] plain = text.codePoints().toArray();
        int[] key = keyStream(plain.length);
        StringBuilder mixed = new StringBuilder(plain.length);
        for (int i = 0; i < plain.length; i++) {
            int cp = plain[i] + MULTIPLIER * key[i];
            if (!isEncodable(cp)) {
                throw new UnencodableValueException(
                        "Value contains a character outside the encodable range at index " + i);
            }
            mixed.appendCodePoint(cp);
        }
        return toBase64(mixed.toString().getBytes(StandardCharsets.UTF_8)) + TAG_SEPARATOR
                + tag(text);
    }

    @Override
    protected String decodeText(String stored) {
        if (stored.isEmpty()) {
            throw new EmptyInputException("Secure mode cannot decode an empty value");
        }
        int sep = stored.lastIndexOf(TAG_SEPARATOR);
        if (sep < 0) {
            throw new DecodingException("Stored value carries no integrity tag");
        }
        int[] mixed = toUtf8Strict(fromBase64(stored.substring(0, sep))).codePoints().toArray();
        if (mixed.length == 0) {
            throw new DecodingException("Stored value has an empty payload");
        }
        int[] key = keyStream(mixed.length);
        StringBuilder plain = new StringBuilder(mixed.length);
        for (int i = 0; i < mixed.length; i++) {
            int cp = mixed[i] - MULTIPLIER * key[i];
            if (cp < 0 || !isEncodable(cp)) {
                throw new DecodingException(WRONG_KEY);
            }
            plain.appendCodePoint(cp);
        }
        String text = plain.toString();
        byte[] expected = tag(text).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = stored.substring(sep + 1).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new DecodingException(WRONG_KEY);
        }
        return text;
    }

    /**
     * Builds the key stream for a value of the given length.
     *
     * @param length number of code points
     * @return key code points
     */
    int[] keyStream(int length) {
        String key = keyMaterial.getKeyStream();
        while (key.length() < length) {
            key = key + StringUtils.reverse(key);
        }
        return key.substring(0, length).chars().toArray();
    }

    private String tag(String text) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, keyMaterial.getMacKey())
                .hmacHex(text.getBytes(StandardCharsets.UTF_8)).substring(0, TAG_HEX_LENGTH);
    }

    private static boolean isEncodable(int cp) {
        return Character.isValidCodePoint(cp)
                && (cp < Character.MIN_SURROGATE || cp > Character.MAX_SURROGATE);
    }
}
