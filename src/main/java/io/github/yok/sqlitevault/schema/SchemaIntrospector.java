package io.github.yok.sqlitevault.schema;

import io.github.yok.sqlitevault.db.ConnectionProvider;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads table metadata from SQLite.
 *
 * <p>
 * Nothing is cached: every call queries the engine, so a column added by another process is
 * visible on the next call. A missing table is a normal result ({@link Optional#empty()} or
 * {@code false}), not an error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaIntrospector {

    private static final String TABLE_INFO_SQL =
            "SELECT cid, name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?)"
                    + " ORDER BY cid";
    private static final String TABLE_EXISTS_SQL =
            "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ? COLLATE NOCASE";
    private static final String TABLE_NAMES_SQL = "SELECT name FROM sqlite_master"
            + " WHERE type = 'table' AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' ORDER BY name";

    private final ConnectionProvider connectionProvider;

    /**
     * Returns the columns of a table in declaration order.
     *
     * @param table table name
     * @return columns, or empty when the table does not exist
     * @throws SQLException if the metadata query fails
     */
    public Optional<List<ColumnDescriptor>> columns(String table) throws SQLException {
        try (Connection conn = connectionProvider.open()) {
            return columns(conn, table);
        }
    }

    /**
     * Returns the columns of a table in declaration order, using an already open connection.
     *
     * @param conn open connection
     * @param table table name
     * @return columns, or empty when the table does not exist
     * @throws SQLException if the metadata query fails
     */
    public Optional<List<ColumnDescriptor>> columns(Connection conn, String table)
            throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(TABLE_INFO_SQL)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnDescriptor(rs.getInt(1), rs.getString(2),
                            StringUtils.trimToNull(rs.getString(3)), rs.getInt(4) != 0,
                            rs.getString(5), rs.getInt(6) != 0));
                }
            }
        }
        if (columns.isEmpty()) {
            log.debug("Table[{}] not found", table);
            return Optional.empty();
        }
        return Optional.of(columns);
    }

    /**
     * Returns whether a table exists.
     *
     * @param table table name (case-insensitive)
     * @return {@code true} when the table exists
     * @throws SQLException if the lookup fails
     */
    public boolean exists(String table) throws SQLException {
        try (Connection conn = connectionProvider.open()) {
            return exists(conn, table);
        }
    }

    /**
     * Returns whether a table exists, using an already open connection.
     *
     * @param conn open connection
     * @param table table name (case-insensitive)
     * @return {@code true} when the table exists
     * @throws SQLException if the lookup fails
     */
    public boolean exists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(TABLE_EXISTS_SQL)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Returns the names of all user tables, sorted by name.
     *
     * @param conn open connection
     * @return table names
     * @throws SQLException if the lookup fails
     */
    public List<String> tableNames(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(TABLE_NAMES_SQL);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }
}
