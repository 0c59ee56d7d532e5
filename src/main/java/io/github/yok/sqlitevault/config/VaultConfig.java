package io.github.yok.sqlitevault.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code vault} section in {@code application.yml}.
 *
 * <pre>
 * vault:
 *   path: data/app.db
 *   data-mode: secure
 *   secret: change-me
 *   busy-timeout-millis: 5000
 *   time-zone: Asia/Tokyo
 * </pre>
 *
 * <p>
 * The values are read once when the database handle is created; changing them afterwards has no
 * effect on an existing handle.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultConfig {

    /**
     * Path of the SQLite database file.
     */
    private String path = "sqlite.db";

    /**
     * Encoding applied to every stored value.
     */
    private DataMode dataMode = DataMode.PLAIN;

    /**
     * Secret used by {@link DataMode#SECURE} and {@link DataMode#AES}. Must be empty for the other
     * modes.
     */
    @ToString.Exclude
    private String secret;

    /**
     * Milliseconds SQLite waits on a locked database file before failing.
     */
    private int busyTimeoutMillis = 5000;

    /**
     * Zone used to turn Unix timestamps into local date-times. Blank means the system default.
     */
    private String timeZone;
}
