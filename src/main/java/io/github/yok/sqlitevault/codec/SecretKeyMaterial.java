package io.github.yok.sqlitevault.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.Validate;

/**
 * Immutable key material derived once from a caller-supplied secret.
 *
 * <p>
 * The secret is hashed with SHA-512. The lowercase hex digest feeds the keyed stream transform;
 * the first half of the raw digest is the AES key and the second half keys the HMAC used for
 * integrity tags and synthetic IVs. The secret itself is not retained.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SecretKeyMaterial {

    private static final int HALF_DIGEST = 32;

    // Lowercase SHA-512 hex digest (128 chars)
    private final String keyStream;
    // AES-256 key
    private final byte[] cipherKey;
    // HMAC-SHA256 key
    private final byte[] macKey;

    private SecretKeyMaterial(byte[] digest) {
        this.keyStream = Hex.encodeHexString(digest);
        this.cipherKey = Arrays.copyOfRange(digest, 0, HALF_DIGEST);
        this.macKey = Arrays.copyOfRange(digest, HALF_DIGEST, digest.length);
    }

    /**
     * Derives key material from a secret.
     *
     * @param secret non-empty secret
     * @return derived key material
     * @throws IllegalArgumentException if {@code secret} is {@code null} or empty
     */
    public static SecretKeyMaterial derive(String secret) {
        Validate.notEmpty(secret, "A data-encryption secret is required");
        return new SecretKeyMaterial(DigestUtils.sha512(secret.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Returns the hex digest used as the base key stream.
     *
     * @return 128 lowercase hex characters
     */
    public String getKeyStream() {
        return keyStream;
    }

    /**
     * Returns a copy of the AES key.
     *
     * @return 32-byte key
     */
    public byte[] getCipherKey() {
        return cipherKey.clone();
    }

    /**
     * Returns a copy of the HMAC key.
     *
     * @return 32-byte key
     */
    public byte[] getMacKey() {
        return macKey.clone();
    }

    @Override
    public String toString() {
        return "SecretKeyMaterial[***]";
    }
}
