package io.github.yok.sqlitevault.codec;

import io.github.yok.sqlitevault.config.DataMode;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Creates the {@link ValueCodec} for a data mode.
 *
 * <p>
 * Keyed modes ({@link DataMode#SECURE}, {@link DataMode#AES}) require a non-empty secret; the
 * other modes refuse one so that a misconfigured handle is caught at start-up instead of silently
 * storing plain values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueCodecFactory {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ValueCodecFactory() {}

    /**
     * Creates a codec.
     *
     * @param mode data mode
     * @param secret secret for keyed modes, {@code null} or empty otherwise
     * @return codec for {@code mode}
     * @throws IllegalArgumentException if the secret does not fit the mode
     */
    public static ValueCodec create(DataMode mode, String secret) {
        Validate.notNull(mode, "dataMode must not be null");
        if (mode.requiresSecret()) {
            Validate.isTrue(StringUtils.isNotEmpty(secret),
                    "%s mode requires a data-encryption secret", mode);
        } else {
            Validate.isTrue(StringUtils.isEmpty(secret),
                    "A secret is only accepted in SECURE or AES mode (was %s)", mode);
        }

        switch (mode) {
            case PLAIN:
                return new PlainValueCodec();
            case OBFUSCATE:
                return new Base64ValueCodec();
            case SECURE:
                return new KeyStreamValueCodec(SecretKeyMaterial.derive(secret));
            case AES:
                return new AesGcmValueCodec(SecretKeyMaterial.derive(secret));
            default:
                throw new IllegalArgumentException("Unsupported data mode: " + mode);
        }
    }
}
