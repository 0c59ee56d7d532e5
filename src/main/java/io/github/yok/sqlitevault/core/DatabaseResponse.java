package io.github.yok.sqlitevault.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result envelope returned by every gateway operation.
 *
 * <p>
 * {@code status} is {@code true} iff the operation affected or returned at least one row.
 * {@code value} carries, depending on the operation:
 * </p>
 * <ul>
 * <li>{@code add}: the caller's original, un-encoded input (a record or a list of records), or
 * {@code null} when validation failed</li>
 * <li>{@code fetch} with {@link FetchMode#ONE}: the first matching record, or {@code null}</li>
 * <li>{@code fetch} with {@link FetchMode#ALL}: the list of matching records, possibly empty</li>
 * <li>{@code remove}, {@code update}: the affected row count</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class DatabaseResponse {

    // At least one row affected or returned
    private final boolean status;
    // Record, record list, row count or null
    private final Object value;
    // Last SQL text executed, null when nothing reached the engine
    private final String query;

    /**
     * Creates a response.
     *
     * @param status whether at least one row was affected or returned
     * @param value carried value
     * @param query last SQL executed, or {@code null}
     * @return response
     */
    public static DatabaseResponse of(boolean status, Object value, String query) {
        return new DatabaseResponse(status, value, query);
    }

    /**
     * Returns the value as a single record.
     *
     * @return read-only copy of the record, or {@code null}
     * @throws IllegalStateException if the value is not a record
     */
    public Map<String, Object> asRecord() {
        if (value == null) {
            return null;
        }
        return toRecord(value);
    }

    /**
     * Returns the value as a list of records; a single record is wrapped in a list.
     *
     * @return read-only copy of the records, empty when the value is {@code null}
     * @throws IllegalStateException if the value is neither a record nor a list of records
     */
    public List<Map<String, Object>> asRecords() {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Map) {
            return Collections.singletonList(toRecord(value));
        }
        if (!(value instanceof List)) {
            throw new IllegalStateException("Response value is not a record list: " + describe());
        }
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object element : (List<?>) value) {
            records.add(toRecord(element));
        }
        return Collections.unmodifiableList(records);
    }

    /**
     * Returns the value as a row count.
     *
     * @return row count
     * @throws IllegalStateException if the value is not a count
     */
    public int asCount() {
        if (!(value instanceof Number)) {
            throw new IllegalStateException("Response value is not a row count: " + describe());
        }
        return ((Number) value).intValue();
    }

    /**
     * Returns how many rows the value stands for: the count itself, the list size, 1 for a single
     * record and 0 for {@code null}.
     *
     * @return size
     */
    public int size() {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        return 1;
    }

    private Map<String, Object> toRecord(Object candidate) {
        if (!(candidate instanceof Map)) {
            throw new IllegalStateException("Response value is not a record: " + describe());
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) candidate).entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw new IllegalStateException("Record key is not a string: " + e.getKey());
            }
            record.put((String) e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(record);
    }

    private String describe() {
        return value == null ? "null" : value.getClass().getName();
    }
}
