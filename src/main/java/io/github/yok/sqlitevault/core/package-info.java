/**
 * Record-level CRUD gateway, the database handle and its result envelope.
 */
package io.github.yok.sqlitevault.core;
