package io.github.yok.sqlitevault.codec;

import io.github.yok.sqlitevault.config.DataMode;

/**
 * Identity codec: values are stored as their string representation.
 *
 * @author Yasuharu.Okawauchi
 */
public class PlainValueCodec extends AbstractValueCodec {

    @Override
    public DataMode getMode() {
        return DataMode.PLAIN;
    }

    @Override
    protected String encodeText(String text) {
        return text;
    }

    @Override
    protected String decodeText(String stored) {
        return stored;
    }
}
