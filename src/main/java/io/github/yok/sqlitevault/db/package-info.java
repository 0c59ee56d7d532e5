/**
 * Storage engine plumbing.
 *
 * <p>
 * Opens SQLite connections, holds the SQL grammar helpers shared by the gateway, and builds the
 * Spring-managed database handle from {@code application.yml}.
 * </p>
 */
package io.github.yok.sqlitevault.db;
