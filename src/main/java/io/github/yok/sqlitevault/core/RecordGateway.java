package io.github.yok.sqlitevault.core;

import io.github.yok.sqlitevault.codec.UnencodableValueException;
import io.github.yok.sqlitevault.codec.ValueCodec;
import io.github.yok.sqlitevault.db.ConnectionProvider;
import io.github.yok.sqlitevault.db.SqliteDialect;
import io.github.yok.sqlitevault.schema.ColumnDescriptor;
import io.github.yok.sqlitevault.schema.SchemaIntrospector;
import io.github.yok.sqlitevault.type.TypeCoercer;
import io.github.yok.sqlitevault.type.TypeKind;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Schema-driven CRUD over a single SQLite database.
 *
 * <p>
 * Every operation reads the target table's columns from the engine, encodes outgoing values with
 * the configured {@link ValueCodec} and decodes and coerces incoming values according to each
 * column's declared type. Column names are matched case-insensitively, as SQLite does. Values are
 * always bound as parameters; identifiers are always quoted.
 * </p>
 *
 * <p>
 * Each operation opens its own auto-commit connection and closes it on every exit path. Records
 * of a multi-record {@code add} are committed one by one; a failure part-way leaves the earlier
 * records in place.
 * </p>
 *
 * <p>
 * Validation failures (unknown column, value of the wrong kind, text the codec cannot represent)
 * are answered with a negative-status {@link DatabaseResponse} and logged at WARN. Every value is
 * encoded before the first statement runs. Calls against a missing table are
 * answered the same way for {@code fetch} and {@code remove}, but raise
 * {@link TableNotFoundException} for {@code add} and {@code update}. Engine errors propagate as
 * {@link SQLException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class RecordGateway {

    private final ConnectionProvider connectionProvider;
    private final SchemaIntrospector introspector;
    private final ValueCodec codec;
    private final TypeCoercer coercer;

    /**
     * Inserts one record.
     *
     * @param record column name to value; omitted columns take their default
     * @param table target table
     * @return response whose value is {@code record} on success, {@code null} when rejected
     * @throws TableNotFoundException if the table does not exist
     * @throws SQLException if the engine rejects the insert
     */
    public DatabaseResponse add(Map<String, ?> record, String table) throws SQLException {
        Validate.notNull(record, "record must not be null");
        return insert(Collections.singletonList(record), record, table);
    }

    /**
     * Inserts several records. Every record is validated before the first one is written.
     *
     * @param records records to insert, in order
     * @param table target table
     * @return response whose value is {@code records} on success, {@code null} when rejected
     * @throws TableNotFoundException if the table does not exist
     * @throws SQLException if the engine rejects an insert
     */
    public DatabaseResponse add(List<? extends Map<String, ?>> records, String table)
            throws SQLException {
        Validate.notNull(records, "records must not be null");
        return insert(records, records, table);
    }

    /**
     * Returns the first row matching {@code predicate}.
     *
     * @param predicate column name to value, all of which must match
     * @param table table to read
     * @return response whose value is the decoded record, or {@code null}
     * @throws SQLException if the query fails
     */
    public DatabaseResponse fetch(Map<String, ?> predicate, String table) throws SQLException {
        return fetch(predicate, table, FetchMode.ONE);
    }

    /**
     * Returns the rows matching {@code predicate}.
     *
     * @param predicate column name to value, all of which must match; empty matches every row
     * @param table table to read
     * @param mode first row only, or every row
     * @return response whose value is a record ({@link FetchMode#ONE}) or a list of records
     *         ({@link FetchMode#ALL})
     * @throws SQLException if the query fails
     */
    public DatabaseResponse fetch(Map<String, ?> predicate, String table, FetchMode mode)
            throws SQLException {
        Validate.notNull(predicate, "predicate must not be null");
        Validate.notNull(mode, "mode must not be null");
        Validate.notBlank(table, "table must not be blank");

        try (Connection conn = connectionProvider.open()) {
            Optional<List<ColumnDescriptor>> columns = introspector.columns(conn, table);
            if (columns.isEmpty()) {
                log.warn("Table[{}] not found. Nothing to fetch.", table);
                return emptyFetch(mode);
            }
            Map<String, ColumnDescriptor> byName = index(columns.get());
            Optional<String> problem = checkKeys(predicate, byName);
            if (problem.isPresent()) {
                log.warn("Table[{}] fetch rejected: {}", table, problem.get());
                return emptyFetch(mode);
            }

            EqualityPredicate where;
            try {
                where = encodePredicate(predicate, byName);
            } catch (UnencodableValueException e) {
                log.warn("Table[{}] fetch rejected: {}", table, e.getMessage());
                return emptyFetch(mode);
            }
            String sql = "SELECT * FROM " + SqliteDialect.quoteIdentifier(table)
                    + where.getWhereClause() + (mode == FetchMode.ONE ? " LIMIT 1" : "");
            log.debug("Table[{}] {} (parameters={})", table, sql, where.getParameters().size());

            List<Map<String, Object>> rows = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bindParameters(ps, where.getParameters());
                try (ResultSet rs = ps.executeQuery()) {
                    ResultSetMetaData md = rs.getMetaData();
                    while (rs.next()) {
                        rows.add(readRow(rs, md, byName));
                    }
                }
            }

            boolean found = !rows.isEmpty();
            if (mode == FetchMode.ONE) {
                return DatabaseResponse.of(found, found ? rows.get(0) : null, sql);
            }
            return DatabaseResponse.of(found, rows, sql);
        }
    }

    /**
     * Deletes every row matching {@code predicate}.
     *
     * @param predicate column name to value; empty deletes every row
     * @param table target table
     * @return response whose value is the deleted row count
     * @throws SQLException if the delete fails
     */
    public DatabaseResponse remove(Map<String, ?> predicate, String table) throws SQLException {
        return remove(predicate, table, null);
    }

    /**
     * Deletes rows matching {@code predicate}.
     *
     * @param predicate column name to value; empty matches every row
     * @param table target table
     * @param limit maximum rows to delete, or {@code null} for no limit
     * @return response whose value is the deleted row count
     * @throws SQLException if the delete fails
     */
    public DatabaseResponse remove(Map<String, ?> predicate, String table, Integer limit)
            throws SQLException {
        Validate.notNull(predicate, "predicate must not be null");
        return remove(Collections.singletonList(predicate), table, limit);
    }

    /**
     * Deletes rows matching any of {@code predicates}, each applied in turn with its own limit.
     *
     * @param predicates filters applied one after another
     * @param table target table
     * @param limit maximum rows to delete per filter, or {@code null} for no limit
     * @return response whose value is the total deleted row count
     * @throws SQLException if a delete fails
     */
    public DatabaseResponse remove(List<? extends Map<String, ?>> predicates, String table,
            Integer limit) throws SQLException {
        Validate.notNull(predicates, "predicates must not be null");
        Validate.notBlank(table, "table must not be blank");
        validateLimit(limit);

        try (Connection conn = connectionProvider.open()) {
            Optional<List<ColumnDescriptor>> columns = introspector.columns(conn, table);
            if (columns.isEmpty()) {
                log.warn("Table[{}] not found. Nothing to remove.", table);
                return DatabaseResponse.of(false, 0, null);
            }
            Map<String, ColumnDescriptor> byName = index(columns.get());
            for (Map<String, ?> predicate : predicates) {
                Optional<String> problem = checkKeys(predicate, byName);
                if (problem.isPresent()) {
                    log.warn("Table[{}] remove rejected: {}", table, problem.get());
                    return DatabaseResponse.of(false, 0, null);
                }
            }

            String quoted = SqliteDialect.quoteIdentifier(table);
            List<BoundStatement> deletes = new ArrayList<>();
            try {
                for (Map<String, ?> predicate : predicates) {
                    EqualityPredicate where = encodePredicate(predicate, byName);
                    List<Object> params = new ArrayList<>(where.getParameters());
                    String sql;
                    if (limit != null) {
                        sql = "DELETE FROM " + quoted
                                + SqliteDialect.limitedRowIdClause(quoted, where.getWhereClause());
                        params.add(limit);
                    } else {
                        sql = "DELETE FROM " + quoted + where.getWhereClause();
                    }
                    deletes.add(new BoundStatement(sql, params));
                }
            } catch (UnencodableValueException e) {
                log.warn("Table[{}] remove rejected: {}", table, e.getMessage());
                return DatabaseResponse.of(false, 0, null);
            }

            int removed = 0;
            String sql = null;
            for (BoundStatement delete : deletes) {
                sql = delete.getSql();
                removed += executeUpdate(conn, table, sql, delete.getParameters());
            }
            log.debug("Table[{}] removed {} row(s)", table, removed);
            return DatabaseResponse.of(removed > 0, removed, sql);
        }
    }

    /**
     * Sets {@code values} on every row matching {@code predicate}.
     *
     * @param predicate column name to value; empty matches every row
     * @param values column name to new value
     * @param table target table
     * @return response whose value is the updated row count
     * @throws EmptyUpdateException if {@code values} is empty
     * @throws TableNotFoundException if the table does not exist
     * @throws SQLException if the update fails
     */
    public DatabaseResponse update(Map<String, ?> predicate, Map<String, ?> values, String table)
            throws SQLException {
        return update(predicate, values, table, null);
    }

    /**
     * Sets {@code values} on rows matching {@code predicate}.
     *
     * <p>
     * New values are encoded but not checked against the declared type; reads coerce by declared
     * type regardless.
     * </p>
     *
     * @param predicate column name to value; empty matches every row
     * @param values column name to new value
     * @param table target table
     * @param limit maximum rows to update, or {@code null} for no limit
     * @return response whose value is the updated row count
     * @throws EmptyUpdateException if {@code values} is empty
     * @throws TableNotFoundException if the table does not exist
     * @throws SQLException if the update fails
     */
    public DatabaseResponse update(Map<String, ?> predicate, Map<String, ?> values, String table,
            Integer limit) throws SQLException {
        Validate.notNull(predicate, "predicate must not be null");
        Validate.notBlank(table, "table must not be blank");
        if (values == null || values.isEmpty()) {
            throw new EmptyUpdateException(table);
        }
        validateLimit(limit);

        try (Connection conn = connectionProvider.open()) {
            Map<String, ColumnDescriptor> byName = index(requireColumns(conn, table));
            Optional<String> problem =
                    checkKeys(values, byName).or(() -> checkKeys(predicate, byName));
            if (problem.isPresent()) {
                log.warn("Table[{}] update rejected: {}", table, problem.get());
                return DatabaseResponse.of(false, 0, null);
            }

            String quoted = SqliteDialect.quoteIdentifier(table);
            StringJoiner assignments = new StringJoiner(", ");
            List<Object> params = new ArrayList<>();
            EqualityPredicate where;
            try {
                for (Map.Entry<String, ?> e : values.entrySet()) {
                    ColumnDescriptor column = byName.get(e.getKey());
                    assignments.add(SqliteDialect.quoteIdentifier(column.getName()) + " = ?");
                    params.add(codec.encode(e.getValue()));
                }
                where = encodePredicate(predicate, byName);
            } catch (UnencodableValueException e) {
                log.warn("Table[{}] update rejected: {}", table, e.getMessage());
                return DatabaseResponse.of(false, 0, null);
            }
            params.addAll(where.getParameters());

            String sql = "UPDATE " + quoted + " SET " + assignments;
            if (limit != null) {
                sql += SqliteDialect.limitedRowIdClause(quoted, where.getWhereClause());
                params.add(limit);
            } else {
                sql += where.getWhereClause();
            }
            int updated = executeUpdate(conn, table, sql, params);
            log.debug("Table[{}] updated {} row(s)", table, updated);
            return DatabaseResponse.of(updated > 0, updated, sql);
        }
    }

    private DatabaseResponse insert(List<? extends Map<String, ?>> records, Object input,
            String table) throws SQLException {
        Validate.notBlank(table, "table must not be blank");
        Validate.noNullElements(records, "records must not contain null: index %d");

        try (Connection conn = connectionProvider.open()) {
            Map<String, ColumnDescriptor> byName = index(requireColumns(conn, table));
            for (int i = 0; i < records.size(); i++) {
                Optional<String> problem = validateRecord(records.get(i), byName);
                if (problem.isPresent()) {
                    log.warn("Table[{}] record #{} rejected: {}", table, i, problem.get());
                    return DatabaseResponse.of(false, null, null);
                }
            }

            List<BoundStatement> inserts = new ArrayList<>();
            for (int i = 0; i < records.size(); i++) {
                try {
                    inserts.add(bindInsert(records.get(i), byName, table));
                } catch (UnencodableValueException e) {
                    log.warn("Table[{}] record #{} rejected: {}", table, i, e.getMessage());
                    return DatabaseResponse.of(false, null, null);
                }
            }

            int inserted = 0;
            String sql = null;
            for (BoundStatement insert : inserts) {
                sql = insert.getSql();
                inserted += executeUpdate(conn, table, sql, insert.getParameters());
            }
            log.debug("Table[{}] inserted {} row(s)", table, inserted);
            return DatabaseResponse.of(inserted > 0, input, sql);
        }
    }

    /**
     * Builds the insert for one validated record, binding its columns in declared order.
     */
    private BoundStatement bindInsert(Map<String, ?> record, Map<String, ColumnDescriptor> byName,
            String table) {
        String quoted = SqliteDialect.quoteIdentifier(table);
        Map<ColumnDescriptor, Object> bound =
                new TreeMap<>(Comparator.comparingInt(ColumnDescriptor::getPosition));
        for (Map.Entry<String, ?> e : record.entrySet()) {
            bound.put(byName.get(e.getKey()), e.getValue());
        }
        if (bound.isEmpty()) {
            return new BoundStatement("INSERT INTO " + quoted + " DEFAULT VALUES",
                    Collections.emptyList());
        }
        StringJoiner names = new StringJoiner(", ", " (", ")");
        StringJoiner marks = new StringJoiner(", ", " VALUES (", ")");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<ColumnDescriptor, Object> e : bound.entrySet()) {
            names.add(SqliteDialect.quoteIdentifier(e.getKey().getName()));
            marks.add("?");
            params.add(codec.encode(e.getValue()));
        }
        return new BoundStatement("INSERT INTO " + quoted + names + marks, params);
    }

    private List<ColumnDescriptor> requireColumns(Connection conn, String table)
            throws SQLException {
        return introspector.columns(conn, table).orElseThrow(() -> {
            log.error("Table[{}] not found", table);
            return new TableNotFoundException(table);
        });
    }

    private Optional<String> validateRecord(Map<String, ?> record,
            Map<String, ColumnDescriptor> byName) {
        Optional<String> problem = checkKeys(record, byName);
        if (problem.isPresent()) {
            return problem;
        }
        for (Map.Entry<String, ?> e : record.entrySet()) {
            ColumnDescriptor column = byName.get(e.getKey());
            Optional<String> mismatch = coercer.explainMismatch(e.getValue(), column.getKind());
            if (mismatch.isPresent()) {
                return Optional.of("column '" + column.getName() + "' ("
                        + column.getDisplayType() + "): " + mismatch.get());
            }
        }
        return Optional.empty();
    }

    /**
     * Checks that every key names a distinct existing column.
     */
    private Optional<String> checkKeys(Map<String, ?> values,
            Map<String, ColumnDescriptor> byName) {
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        Set<?> keys = values.keySet();
        for (Object key : keys) {
            if (!(key instanceof String)) {
                return Optional.of("column key is not a string: " + key);
            }
            ColumnDescriptor column = byName.get(key);
            if (column == null) {
                return Optional.of("no such column '" + key + "'");
            }
            if (!seen.add(column.getName())) {
                return Optional.of("column '" + column.getName() + "' given more than once");
            }
        }
        return Optional.empty();
    }

    private EqualityPredicate encodePredicate(Map<String, ?> predicate,
            Map<String, ColumnDescriptor> byName) {
        Map<String, String> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : predicate.entrySet()) {
            encoded.put(byName.get(e.getKey()).getName(), codec.encode(e.getValue()));
        }
        return EqualityPredicate.of(encoded);
    }

    private Map<String, Object> readRow(ResultSet rs, ResultSetMetaData md,
            Map<String, ColumnDescriptor> byName) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            String label = md.getColumnLabel(i);
            ColumnDescriptor column = byName.get(label);
            TypeKind kind = column == null ? TypeKind.OPAQUE : column.getKind();
            String name = column == null ? label : column.getName();
            row.put(name, coercer.coerceOnRead(codec.decode(rs.getString(i)), kind));
        }
        return row;
    }

    private int executeUpdate(Connection conn, String table, String sql, List<Object> params)
            throws SQLException {
        log.debug("Table[{}] {} (parameters={})", table, sql, params.size());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParameters(ps, params);
            return ps.executeUpdate();
        }
    }

    private static void bindParameters(PreparedStatement ps, List<Object> params)
            throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object param = params.get(i);
            if (param == null) {
                ps.setNull(i + 1, Types.NULL);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private static Map<String, ColumnDescriptor> index(List<ColumnDescriptor> columns) {
        Map<String, ColumnDescriptor> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (ColumnDescriptor column : columns) {
            byName.put(column.getName(), column);
        }
        return byName;
    }

    private static DatabaseResponse emptyFetch(FetchMode mode) {
        return DatabaseResponse.of(false, mode == FetchMode.ONE ? null : new ArrayList<>(), null);
    }

    private static void validateLimit(Integer limit) {
        Validate.isTrue(limit == null || limit > 0, "limit must be positive: %s", limit);
    }

    // SQL text with its encoded parameters, ready to run
    @Value
    private static class BoundStatement {
        String sql;
        List<Object> parameters;
    }
}
