package io.github.yok.sqlitevault.core;

/**
 * How many matching rows {@code fetch} returns.
 *
 * @author Yasuharu.Okawauchi
 */
public enum FetchMode {
    // First matching row as a single record, or null
    ONE,
    // Every matching row, possibly none
    ALL
}
