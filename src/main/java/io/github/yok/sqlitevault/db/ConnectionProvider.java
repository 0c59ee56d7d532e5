package io.github.yok.sqlitevault.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Opens JDBC connections to a single SQLite database file.
 *
 * <p>
 * Every call to {@link #open()} returns a fresh connection; callers own it and must close it.
 * Because connections are not pooled, an in-memory path ({@code :memory:}) yields a new empty
 * database each time and is of no use here.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class ConnectionProvider {

    static final String URL_PREFIX = "jdbc:sqlite:";
    // sqlite-jdbc connection property mapped to PRAGMA busy_timeout
    static final String BUSY_TIMEOUT_PROPERTY = "busy_timeout";

    // Database file path
    private final String path;
    // Milliseconds to wait on a locked database file
    private final int busyTimeoutMillis;

    /**
     * Creates a provider.
     *
     * @param path database file path
     * @param busyTimeoutMillis milliseconds to wait on a locked database file
     * @throws IllegalArgumentException if {@code path} is blank or the timeout is negative
     */
    public ConnectionProvider(String path, int busyTimeoutMillis) {
        Validate.notBlank(path, "database path must not be blank");
        Validate.isTrue(busyTimeoutMillis >= 0, "busyTimeoutMillis must be >= 0: %d",
                busyTimeoutMillis);
        this.path = path;
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    /**
     * Returns the JDBC URL of the database file.
     *
     * @return JDBC URL
     */
    public String getUrl() {
        return URL_PREFIX + path;
    }

    /**
     * Opens a new auto-commit connection.
     *
     * @return open connection
     * @throws SQLException if the file cannot be opened
     */
    public Connection open() throws SQLException {
        Properties props = new Properties();
        props.setProperty(BUSY_TIMEOUT_PROPERTY, String.valueOf(busyTimeoutMillis));
        log.trace("Opening connection: {}", getUrl());
        return DriverManager.getConnection(getUrl(), props);
    }
}
