/**
 * Logging helpers.
 */
package io.github.yok.sqlitevault.util;
