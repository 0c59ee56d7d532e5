package io.github.yok.sqlitevault.config;

/**
 * Enumerates the field encodings a database handle can apply to stored values.
 *
 * <p>
 * The mode is chosen once per handle and applies uniformly to every value written or read.
 * </p>
 *
 * <ul>
 * <li>PLAIN: values are stored as their string representation</li>
 * <li>OBFUSCATE: values are Base64 wrapped; no confidentiality</li>
 * <li>SECURE: values go through the keyed stream transform; requires a secret</li>
 * <li>AES: values are sealed with AES-GCM; requires a secret</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DataMode {
    // Identity encoding
    PLAIN,
    // Base64 over UTF-8
    OBFUSCATE,
    // Keyed stream transform (not cryptographic strength)
    SECURE,
    // Authenticated AES-GCM encryption
    AES;

    /**
     * Returns whether this mode derives key material from a caller-supplied secret.
     *
     * @return {@code true} for {@link #SECURE} and {@link #AES}
     */
    public boolean requiresSecret() {
        return this == SECURE || this == AES;
    }
}
