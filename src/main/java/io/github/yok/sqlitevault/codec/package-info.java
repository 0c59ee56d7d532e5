/**
 * Field encoding package.
 *
 * <p>
 * Every value written through the gateway passes through exactly one {@link
 * io.github.yok.sqlitevault.codec.ValueCodec}, chosen by the handle's data mode, and every value
 * read back passes through its inverse. Codec failures are reported as {@link
 * io.github.yok.sqlitevault.codec.CodecException} subclasses.
 * </p>
 */
package io.github.yok.sqlitevault.codec;
