/**
 * Schema introspection package.
 *
 * <p>
 * Reads column names and declared types from SQLite metadata on every call and captures
 * point-in-time table snapshots for listings.
 * </p>
 */
package io.github.yok.sqlitevault.schema;
