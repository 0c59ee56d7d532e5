package io.github.yok.sqlitevault.schema;

import com.google.common.collect.ImmutableList;
import io.github.yok.sqlitevault.db.SqliteDialect;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Point-in-time view of a table: its columns and its raw stored rows.
 *
 * <p>
 * Rows hold storage strings exactly as they sit in the file (still encoded in non-plain modes).
 * The snapshot is read once when it is loaded and never refreshed; use the gateway for live,
 * decoded reads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class TableSnapshot {

    // Table name
    private final String name;
    // Columns in declaration order
    private final List<ColumnDescriptor> columns;
    // Raw rows keyed by column name
    private final List<Map<String, String>> rows;
    // true when created by this handle, false when it already existed, null when unknown
    private final Boolean created;

    private TableSnapshot(String name, List<ColumnDescriptor> columns,
            List<Map<String, String>> rows, Boolean created) {
        this.name = name;
        this.columns = ImmutableList.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
        this.created = created;
    }

    /**
     * Loads a snapshot of a table.
     *
     * @param conn open connection
     * @param introspector metadata reader
     * @param name table name
     * @param created creation flag to record, or {@code null}
     * @return snapshot, or empty when the table does not exist
     * @throws SQLException if reading fails
     */
    public static Optional<TableSnapshot> load(Connection conn, SchemaIntrospector introspector,
            String name, Boolean created) throws SQLException {
        Optional<List<ColumnDescriptor>> columns = introspector.columns(conn, name);
        if (columns.isEmpty()) {
            return Optional.empty();
        }
        List<Map<String, String>> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT * FROM " + SqliteDialect.quoteIdentifier(name))) {
            ResultSetMetaData md = rs.getMetaData();
            int colCount = md.getColumnCount();
            while (rs.next()) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 1; i <= colCount; i++) {
                    row.put(md.getColumnLabel(i), rs.getString(i));
                }
                rows.add(Collections.unmodifiableMap(row));
            }
        }
        return Optional.of(new TableSnapshot(name, columns.get(), rows, created));
    }

    /**
     * Returns the display type of each column ({@code BLOB} for untyped columns).
     *
     * @return column name to display type, in declaration order
     */
    public Map<String, String> getTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        for (ColumnDescriptor column : columns) {
            types.put(column.getName(), column.getDisplayType());
        }
        return types;
    }

    /**
     * Returns the number of rows captured.
     *
     * @return row count
     */
    public int getRowCount() {
        return rows.size();
    }

    /**
     * Renders the snapshot as an ASCII table whose header shows {@code name: TYPE} per column.
     *
     * @return multi-line rendering
     */
    public String prettyPrint() {
        int colCount = columns.size();
        String[] headers = new String[colCount];
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) {
            ColumnDescriptor column = columns.get(i);
            headers[i] = column.getName() + ": " + column.getDisplayType();
            widths[i] = headers[i].length();
        }
        for (Map<String, String> row : rows) {
            for (int i = 0; i < colCount; i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }

        String divider = divider(widths);
        StringBuilder sb = new StringBuilder();
        sb.append("table ").append(name).append(':').append(System.lineSeparator());
        sb.append(divider).append(System.lineSeparator());
        sb.append(line(headers, widths)).append(System.lineSeparator());
        sb.append(divider).append(System.lineSeparator());
        for (Map<String, String> row : rows) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) {
                cells[i] = cell(row, i);
            }
            sb.append(line(cells, widths)).append(System.lineSeparator());
        }
        sb.append(divider).append(System.lineSeparator());
        sb.append('(').append(rows.size()).append(" row(s))");
        return sb.toString();
    }

    private String cell(Map<String, String> row, int index) {
        return String.valueOf(row.get(columns.get(index).getName()));
    }

    private static String divider(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) {
            sb.append(StringUtils.repeat('-', w + 2)).append('+');
        }
        return sb.toString();
    }

    private static String line(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(StringUtils.rightPad(cells[i], widths[i])).append(" |");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TableSnapshot(name=" + name + ", rows=" + rows.size() + ")";
    }
}
