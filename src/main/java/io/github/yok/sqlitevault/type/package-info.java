/**
 * Schema-driven type coercion package.
 *
 * <p>
 * Maps declared SQL types to {@link io.github.yok.sqlitevault.type.TypeKind} and converts values
 * between their storage text and their logical Java type.
 * </p>
 */
package io.github.yok.sqlitevault.type;
