package io.github.yok.sqlitevault.core;

import io.github.yok.sqlitevault.db.SqliteDialect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import lombok.Getter;

/**
 * {@code AND}-conjoined equality filter over already encoded values.
 *
 * <p>
 * Values are always bound as parameters; only column names, quoted, appear in the SQL text. A
 * {@code null} value renders {@code "col" IS NULL}. An empty filter renders no {@code WHERE}
 * clause and matches every row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class EqualityPredicate {

    // " WHERE ..." or empty
    private final String whereClause;
    // Bound values in placeholder order
    private final List<Object> parameters;

    private EqualityPredicate(String whereClause, List<Object> parameters) {
        this.whereClause = whereClause;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    /**
     * Builds a predicate.
     *
     * @param encoded column name to encoded value, in the order the conditions should appear
     * @return predicate
     */
    public static EqualityPredicate of(Map<String, String> encoded) {
        if (encoded.isEmpty()) {
            return new EqualityPredicate("", new ArrayList<>());
        }
        StringJoiner conditions = new StringJoiner(" AND ", " WHERE ", "");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, String> e : encoded.entrySet()) {
            String column = SqliteDialect.quoteIdentifier(e.getKey());
            if (e.getValue() == null) {
                conditions.add(column + " IS NULL");
            } else {
                conditions.add(column + " = ?");
                params.add(e.getValue());
            }
        }
        return new EqualityPredicate(conditions.toString(), params);
    }

    /**
     * Returns whether the predicate matches every row.
     *
     * @return {@code true} when there are no conditions
     */
    public boolean isEmpty() {
        return whereClause.isEmpty();
    }
}
