package io.github.yok.sqlitevault.util;

import io.github.yok.sqlitevault.config.VaultConfig;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders configuration for log output with secrets hidden.
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    // Replacement for any non-empty secret
    public static final String MASK = "***";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a secret. {@code null} and empty values are shown as such so that a missing secret is
     * still visible in the log.
     *
     * @param secret secret, may be {@code null}
     * @return {@code "null"}, {@code ""} or {@link #MASK}
     */
    public static String maskSecret(String secret) {
        if (secret == null) {
            return "null";
        }
        return secret.isEmpty() ? "" : MASK;
    }

    /**
     * Describes a configuration on one line.
     *
     * @param config configuration
     * @return description with the secret masked
     */
    public static String describe(VaultConfig config) {
        return String.format("path=%s, dataMode=%s, secret=%s, busyTimeoutMillis=%d, timeZone=%s",
                config.getPath(), config.getDataMode(), maskSecret(config.getSecret()),
                config.getBusyTimeoutMillis(),
                StringUtils.defaultIfBlank(config.getTimeZone(), "(system)"));
    }
}
