package io.github.yok.sqlitevault.db;

import lombok.Generated;
import org.apache.commons.lang3.Validate;

/**
 * SQL grammar helpers for SQLite.
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqliteDialect {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private SqliteDialect() {}

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier table or column name
     * @return quoted identifier
     * @throws IllegalArgumentException if {@code identifier} is blank
     */
    public static String quoteIdentifier(String identifier) {
        Validate.notBlank(identifier, "identifier must not be blank");
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /**
     * Wraps a row filter so that at most {@code ?} rows are affected, using a {@code rowid}
     * sub-select. This works whether or not SQLite was built with {@code DELETE ... LIMIT}
     * support; the limit is bound as the last parameter.
     *
     * @param quotedTable quoted table name
     * @param whereClause filter starting with {@code " WHERE "}, or empty
     * @return {@code " WHERE rowid IN (...)"} clause
     */
    public static String limitedRowIdClause(String quotedTable, String whereClause) {
        return " WHERE rowid IN (SELECT rowid FROM " + quotedTable + whereClause + " LIMIT ?)";
    }
}
