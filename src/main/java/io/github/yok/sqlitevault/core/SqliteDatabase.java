package io.github.yok.sqlitevault.core;

import io.github.yok.sqlitevault.codec.ValueCodec;
import io.github.yok.sqlitevault.codec.ValueCodecFactory;
import io.github.yok.sqlitevault.config.DataMode;
import io.github.yok.sqlitevault.db.ConnectionProvider;
import io.github.yok.sqlitevault.db.SqliteDialect;
import io.github.yok.sqlitevault.schema.ColumnDescriptor;
import io.github.yok.sqlitevault.schema.SchemaIntrospector;
import io.github.yok.sqlitevault.schema.TableSnapshot;
import io.github.yok.sqlitevault.type.TypeCoercer;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Handle on one SQLite database file in one data mode.
 *
 * <p>
 * Record operations delegate to {@link RecordGateway}. The handle adds table-level helpers:
 * listing, creating, snapshotting and dropping tables, and running raw SQL. Raw SQL bypasses the
 * codec entirely.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SqliteDatabase {

    // Busy timeout used by open(...)
    public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    private final ConnectionProvider connectionProvider;
    private final SchemaIntrospector introspector;
    // Codec selected for this handle
    private final ValueCodec codec;
    private final RecordGateway gateway;

    /**
     * Creates a handle.
     *
     * @param connectionProvider connection source
     * @param codec value codec
     * @param coercer type coercer
     */
    public SqliteDatabase(ConnectionProvider connectionProvider, ValueCodec codec,
            TypeCoercer coercer) {
        this.connectionProvider = connectionProvider;
        this.introspector = new SchemaIntrospector(connectionProvider);
        this.codec = codec;
        this.gateway = new RecordGateway(connectionProvider, introspector, codec, coercer);
    }

    /**
     * Opens a handle with the default busy timeout and the system time zone.
     *
     * @param path database file path
     * @param mode data mode
     * @param secret secret for keyed modes, {@code null} otherwise
     * @return handle
     * @throws IllegalArgumentException if the secret does not fit the mode
     */
    public static SqliteDatabase open(String path, DataMode mode, String secret) {
        return new SqliteDatabase(new ConnectionProvider(path, DEFAULT_BUSY_TIMEOUT_MILLIS),
                ValueCodecFactory.create(mode, secret), new TypeCoercer());
    }

    public String getPath() {
        return connectionProvider.getPath();
    }

    public DataMode getDataMode() {
        return codec.getMode();
    }

    public DatabaseResponse add(Map<String, ?> record, String table) throws SQLException {
        return gateway.add(record, table);
    }

    public DatabaseResponse add(List<? extends Map<String, ?>> records, String table)
            throws SQLException {
        return gateway.add(records, table);
    }

    public DatabaseResponse fetch(Map<String, ?> predicate, String table) throws SQLException {
        return gateway.fetch(predicate, table);
    }

    public DatabaseResponse fetch(Map<String, ?> predicate, String table, FetchMode mode)
            throws SQLException {
        return gateway.fetch(predicate, table, mode);
    }

    public DatabaseResponse remove(Map<String, ?> predicate, String table) throws SQLException {
        return gateway.remove(predicate, table);
    }

    public DatabaseResponse remove(Map<String, ?> predicate, String table, Integer limit)
            throws SQLException {
        return gateway.remove(predicate, table, limit);
    }

    public DatabaseResponse remove(List<? extends Map<String, ?>> predicates, String table,
            Integer limit) throws SQLException {
        return gateway.remove(predicates, table, limit);
    }

    public DatabaseResponse update(Map<String, ?> predicate, Map<String, ?> values, String table)
            throws SQLException {
        return gateway.update(predicate, values, table);
    }

    public DatabaseResponse update(Map<String, ?> predicate, Map<String, ?> values, String table,
            Integer limit) throws SQLException {
        return gateway.update(predicate, values, table, limit);
    }

    /**
     * Returns the columns of a table.
     *
     * @param table table name
     * @return columns in declaration order, or empty when the table does not exist
     * @throws SQLException if the metadata query fails
     */
    public Optional<List<ColumnDescriptor>> columns(String table) throws SQLException {
        return introspector.columns(table);
    }

    public boolean exists(String table) throws SQLException {
        return introspector.exists(table);
    }

    /**
     * Returns a snapshot of every user table, sorted by name.
     *
     * @return snapshots
     * @throws SQLException if reading fails
     */
    public List<TableSnapshot> tables() throws SQLException {
        List<TableSnapshot> snapshots = new ArrayList<>();
        try (Connection conn = connectionProvider.open()) {
            for (String name : introspector.tableNames(conn)) {
                TableSnapshot.load(conn, introspector, name, null).ifPresent(snapshots::add);
            }
        }
        return snapshots;
    }

    /**
     * Returns a snapshot of one table.
     *
     * @param name table name
     * @return snapshot, or empty when the table does not exist
     * @throws SQLException if reading fails
     */
    public Optional<TableSnapshot> snapshot(String name) throws SQLException {
        try (Connection conn = connectionProvider.open()) {
            return TableSnapshot.load(conn, introspector, name, null);
        }
    }

    /**
     * Creates a table unless it already exists, then returns its snapshot.
     *
     * <p>
     * Column definitions are passed to the engine verbatim, e.g. {@code "id INTEGER"} or
     * {@code "name TEXT NOT NULL"}. They are not compared with an existing table's columns.
     * </p>
     *
     * @param name table name
     * @param columnDefinitions column definitions
     * @return snapshot whose {@code created} flag tells whether the table was new
     * @throws SQLException if the statement fails
     */
    public TableSnapshot table(String name, String... columnDefinitions) throws SQLException {
        Validate.notEmpty(columnDefinitions, "at least one column definition is required");
        Validate.noNullElements(columnDefinitions, "column definition must not be null: index %d");
        try (Connection conn = connectionProvider.open()) {
            boolean existed = introspector.exists(conn, name);
            String sql = "CREATE TABLE IF NOT EXISTS " + SqliteDialect.quoteIdentifier(name) + " ("
                    + String.join(", ", columnDefinitions) + ")";
            log.debug("Table[{}] {}", name, sql);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
            }
            if (!existed) {
                log.info("Table[{}] created", name);
            }
            return TableSnapshot.load(conn, introspector, name, !existed)
                    .orElseThrow(() -> new IllegalStateException("Table vanished: " + name));
        }
    }

    /**
     * Drops a table.
     *
     * @param name table name
     * @return {@code true} when the table existed and was dropped
     * @throws SQLException if the statement fails
     */
    public boolean dropTable(String name) throws SQLException {
        try (Connection conn = connectionProvider.open()) {
            if (!introspector.exists(conn, name)) {
                log.warn("Table[{}] not found. Nothing to drop.", name);
                return false;
            }
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE " + SqliteDialect.quoteIdentifier(name));
            }
            log.info("Table[{}] dropped", name);
            return true;
        }
    }

    /**
     * Runs a raw SQL statement. Values are neither encoded nor decoded.
     *
     * @param sql SQL text
     * @return rows as stored (for a query) or the affected row count
     * @throws SQLException if the statement fails
     */
    public DatabaseResponse execute(String sql) throws SQLException {
        Validate.notBlank(sql, "sql must not be blank");
        log.debug("Raw SQL: {}", sql);
        try (Connection conn = connectionProvider.open();
                Statement stmt = conn.createStatement()) {
            if (!stmt.execute(sql)) {
                int count = stmt.getUpdateCount();
                return DatabaseResponse.of(count > 0, count, sql);
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = stmt.getResultSet()) {
                ResultSetMetaData md = rs.getMetaData();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= md.getColumnCount(); i++) {
                        row.put(md.getColumnLabel(i), rs.getObject(i));
                    }
                    rows.add(row);
                }
            }
            return DatabaseResponse.of(!rows.isEmpty(), rows, sql);
        }
    }
}
