package io.github.yok.sqlitevault.codec;

import io.github.yok.sqlitevault.config.DataMode;
import java.nio.charset.StandardCharsets;

/**
 * Obfuscating codec: the UTF-8 bytes of a value are stored as standard Base64.
 *
 * <p>
 * Offers no confidentiality; it only keeps values from being readable at a glance in the raw
 * database file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class Base64ValueCodec extends AbstractValueCodec {

    @Override
    public DataMode getMode() {
        return DataMode.OBFUSCATE;
    }

    @Override
    protected String encodeText(String text) {
        return toBase64(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected String decodeText(String stored) {
        return toUtf8Strict(fromBase64(stored));
    }
}
