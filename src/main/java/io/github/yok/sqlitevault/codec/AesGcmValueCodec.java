package io.github.yok.sqlitevault.codec;

import com.google.common.primitives.Bytes;
import io.github.yok.sqlitevault.config.DataMode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.apache.commons.lang3.Validate;

/**
 * Codec for {@link DataMode#AES}: authenticated encryption with AES-256/GCM.
 *
 * <p>
 * The IV is synthetic: the first 96 bits of an HMAC-SHA256 of the plain text under a separate key.
 * Equal values therefore seal to equal ciphertexts, which keeps equality predicates usable, at the
 * cost of revealing which stored values are equal. Storage format is
 * {@code Base64(iv || ciphertext || tag)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class AesGcmValueCodec extends AbstractValueCodec {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec cipherKey;
    private final byte[] macKey;

    /**
     * Creates a codec bound to the given key material.
     *
     * @param keyMaterial derived key material
     */
    public AesGcmValueCodec(SecretKeyMaterial keyMaterial) {
        Validate.notNull(keyMaterial, "keyMaterial must not be null");
        this.cipherKey = new SecretKeySpec(keyMaterial.getCipherKey(), "AES");
        this.macKey = keyMaterial.getMacKey();
    }

    @Override
    public DataMode getMode() {
        return DataMode.AES;
    }

    @Override
    protected String encodeText(String text) {
        byte[] plain = text.getBytes(StandardCharsets.UTF_8);
        byte[] iv = Arrays.copyOf(new HmacUtils(HmacAlgorithms.HMAC_SHA_256, macKey).hmac(plain),
                IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, cipherKey, new GCMParameterSpec(TAG_BITS, iv));
            return toBase64(Bytes.concat(iv, cipher.doFinal(plain)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    @Override
    protected String decodeText(String stored) {
        byte[] sealed = fromBase64(stored);
        if (sealed.length < IV_LENGTH + TAG_BITS / 8) {
            throw new DecodingException("Stored value is too short to be AES-GCM sealed");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, cipherKey,
                    new GCMParameterSpec(TAG_BITS, sealed, 0, IV_LENGTH));
            return toUtf8Strict(cipher.doFinal(sealed, IV_LENGTH, sealed.length - IV_LENGTH));
        } catch (AEADBadTagException e) {
            throw new DecodingException(
                    "Stored value was not sealed under the configured secret or has been altered",
                    e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }
}
