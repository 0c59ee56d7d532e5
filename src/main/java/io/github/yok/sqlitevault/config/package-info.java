/**
 * Configuration model package for SqliteVault.
 *
 * <p>
 * Holds the values bound from {@code application.yml}: the database file, the data mode and its
 * secret, and the connection timeout. Execution logic lives in {@code core} and {@code db}.
 * </p>
 */
package io.github.yok.sqlitevault.config;
