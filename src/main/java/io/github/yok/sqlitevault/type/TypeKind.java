package io.github.yok.sqlitevault.type;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Semantic category a column's declared SQL type maps to.
 *
 * <p>
 * Classification is a static lookup against fixed lexical tables; it is case-insensitive and
 * collapses repeated whitespace, but otherwise requires an exact match. Anything not listed,
 * including {@code BLOB}, parameterized types such as {@code VARCHAR(20)} and untyped columns, is
 * {@link #OPAQUE}.
 * </p>
 *
 * <ul>
 * <li>INTEGER: INT, INTEGER, TINYINT, SMALLINT, MEDIUMINT, BIGINT, UNSIGNED BIG INT</li>
 * <li>REAL: REAL, DOUBLE, DOUBLE PRECISION, FLOAT</li>
 * <li>BOOLEAN: BOOLEAN, BOOL</li>
 * <li>TIMESTAMP: DATE, DATETIME, TIME</li>
 * <li>TEXT: TEXT</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum TypeKind {
    // Whole numbers, read back as Long
    INTEGER,
    // Floating point, read back as Double
    REAL,
    // Truth values, read back as Boolean
    BOOLEAN,
    // Date/time, read back as LocalDateTime
    TIMESTAMP,
    // Character data, read back as String
    TEXT,
    // No coercion or validation
    OPAQUE;

    private static final ImmutableMap<String, TypeKind> DECLARED_TYPES =
            ImmutableMap.<String, TypeKind>builder().put("INT", INTEGER).put("INTEGER", INTEGER)
                    .put("TINYINT", INTEGER).put("SMALLINT", INTEGER).put("MEDIUMINT", INTEGER)
                    .put("BIGINT", INTEGER).put("UNSIGNED BIG INT", INTEGER).put("REAL", REAL)
                    .put("DOUBLE", REAL).put("DOUBLE PRECISION", REAL).put("FLOAT", REAL)
                    .put("BOOLEAN", BOOLEAN).put("BOOL", BOOLEAN).put("DATE", TIMESTAMP)
                    .put("DATETIME", TIMESTAMP).put("TIME", TIMESTAMP).put("TEXT", TEXT).build();

    /**
     * Classifies a declared column type.
     *
     * @param declaredType declared type as reported by the engine, or {@code null}
     * @return matching kind, {@link #OPAQUE} when unknown or absent
     */
    public static TypeKind classify(String declaredType) {
        if (StringUtils.isBlank(declaredType)) {
            return OPAQUE;
        }
        String normalized = StringUtils.normalizeSpace(declaredType).toUpperCase(Locale.ROOT);
        return DECLARED_TYPES.getOrDefault(normalized, OPAQUE);
    }
}
