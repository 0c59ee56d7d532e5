package io.github.yok.sqlitevault.db;

import io.github.yok.sqlitevault.codec.ValueCodec;
import io.github.yok.sqlitevault.codec.ValueCodecFactory;
import io.github.yok.sqlitevault.config.VaultConfig;
import io.github.yok.sqlitevault.core.SqliteDatabase;
import io.github.yok.sqlitevault.type.TypeCoercer;
import io.github.yok.sqlitevault.util.MaskingLogUtil;
import java.time.DateTimeException;
import java.time.ZoneId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link SqliteDatabase} from {@link VaultConfig}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqliteDatabaseFactory {

    // Bound vault settings
    private final VaultConfig vaultConfig;

    /**
     * Creates a handle from the current configuration.
     *
     * @return database handle
     * @throws IllegalArgumentException if the secret does not fit the data mode, or the time zone
     *         is unknown
     */
    public SqliteDatabase create() {
        log.info("Opening SQLite database: {}", MaskingLogUtil.describe(vaultConfig));
        ZoneId zone = resolveZone(vaultConfig.getTimeZone());
        ValueCodec codec =
                ValueCodecFactory.create(vaultConfig.getDataMode(), vaultConfig.getSecret());
        ConnectionProvider provider =
                new ConnectionProvider(vaultConfig.getPath(), vaultConfig.getBusyTimeoutMillis());
        return new SqliteDatabase(provider, codec, new TypeCoercer(zone));
    }

    static ZoneId resolveZone(String timeZone) {
        if (StringUtils.isBlank(timeZone)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            String msg = "Unknown vault.time-zone: " + timeZone;
            log.error(msg);
            throw new IllegalArgumentException(msg, e);
        }
    }
}
