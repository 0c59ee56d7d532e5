package io.github.yok.sqlitevault.type;

import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Reconciles values with a column's {@link TypeKind}.
 *
 * <p>
 * On read, a decoded storage string is converted to the Java type implied by the column's
 * declared type, whatever type was originally written. On write, a logical value is checked
 * against that kind before it is encoded.
 * </p>
 *
 * <table>
 * <caption>Kind mapping</caption>
 * <tr>
 * <th>Kind</th>
 * <th>Read as</th>
 * <th>Accepted on write</th>
 * </tr>
 * <tr>
 * <td>INTEGER</td>
 * <td>{@link Long} ({@link BigInteger} beyond 64 bits)</td>
 * <td>Integer, Long, Short, Byte, BigInteger within 64 bits</td>
 * </tr>
 * <tr>
 * <td>REAL</td>
 * <td>{@link Double}</td>
 * <td>Double, Float, BigDecimal</td>
 * </tr>
 * <tr>
 * <td>BOOLEAN</td>
 * <td>{@link Boolean}</td>
 * <td>Boolean</td>
 * </tr>
 * <tr>
 * <td>TIMESTAMP</td>
 * <td>{@link LocalDateTime}</td>
 * <td>any Number (Unix seconds), ISO-8601 text, java.time date/time values</td>
 * </tr>
 * <tr>
 * <td>TEXT</td>
 * <td>{@link String}</td>
 * <td>CharSequence</td>
 * </tr>
 * <tr>
 * <td>OPAQUE</td>
 * <td>{@link String}, unchanged</td>
 * <td>anything</td>
 * </tr>
 * </table>
 *
 * <p>
 * {@code null} is passed through on read and always accepted on write; NOT NULL constraints are
 * the engine's business.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TypeCoercer {

    // Signed decimals, with an optional fraction and exponent, are Unix seconds
    private static final Pattern UNIX_SECONDS =
            Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");
    private static final Pattern SIGNED_DECIMAL = Pattern.compile("[-+]?\\d+(\\.\\d+)?");
    private static final ImmutableSet<String> FALSE_LITERALS = ImmutableSet.of("", "false");

    private final ZoneId zone;

    /**
     * Creates a coercer that reads Unix timestamps in the system default zone.
     */
    public TypeCoercer() {
        this(ZoneId.systemDefault());
    }

    /**
     * Creates a coercer.
     *
     * @param zone zone used to turn Unix timestamps into local date-times
     */
    public TypeCoercer(ZoneId zone) {
        this.zone = Validate.notNull(zone, "zone must not be null");
    }

    /**
     * Returns the zone used for Unix timestamps.
     *
     * @return zone
     */
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Classifies a declared column type.
     *
     * @param declaredType declared type, or {@code null}
     * @return kind
     */
    public TypeKind classify(String declaredType) {
        return TypeKind.classify(declaredType);
    }

    /**
     * Converts a decoded storage string to the Java type of {@code kind}.
     *
     * @param stored decoded storage string, or {@code null}
     * @param kind column kind
     * @return converted value, or {@code null} when {@code stored} is {@code null}
     * @throws TypeConversionException if {@code stored} cannot be read as {@code kind}
     */
    public Object coerceOnRead(String stored, TypeKind kind) {
        if (stored == null) {
            return null;
        }
        try {
            switch (kind) {
                case INTEGER:
                    return toInteger(stored.trim());
                case REAL:
                    return Double.valueOf(stored.trim());
                case BOOLEAN:
                    return toBoolean(stored.trim());
                case TIMESTAMP:
                    return toTimestamp(stored);
                case TEXT:
                case OPAQUE:
                default:
                    return stored;
            }
        } catch (DateTimeException | ArithmeticException | IllegalArgumentException e) {
            throw new TypeConversionException(String.format("Cannot read '%s' as %s",
                    StringUtils.abbreviate(stored, 32), kind), e);
        }
    }

    /**
     * Checks whether a logical value may be written to a column of {@code kind}.
     *
     * @param value logical value, or {@code null}
     * @param kind column kind
     * @return {@code true} when the value is acceptable
     */
    public boolean validateOnWrite(Object value, TypeKind kind) {
        return explainMismatch(value, kind).isEmpty();
    }

    /**
     * Describes why a logical value may not be written to a column of {@code kind}.
     *
     * @param value logical value, or {@code null}
     * @param kind column kind
     * @return reason for rejection, or empty when the value is acceptable
     */
    public Optional<String> explainMismatch(Object value, TypeKind kind) {
        if (value == null || kind == TypeKind.OPAQUE) {
            return Optional.empty();
        }
        boolean accepted;
        switch (kind) {
            case INTEGER:
                if (value instanceof BigInteger && ((BigInteger) value).bitLength() > 63) {
                    return Optional.of("BigInteger value " + value
                            + " is outside the 64-bit INTEGER range");
                }
                accepted = value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte
                        || value instanceof BigInteger;
                break;
            case REAL:
                accepted = value instanceof Double || value instanceof Float
                        || value instanceof BigDecimal;
                break;
            case BOOLEAN:
                accepted = value instanceof Boolean;
                break;
            case TEXT:
                accepted = value instanceof CharSequence;
                break;
            case TIMESTAMP:
                try {
                    toTimestamp(value);
                    return Optional.empty();
                } catch (DateTimeException | ArithmeticException | IllegalArgumentException e) {
                    return Optional.of(value.getClass().getSimpleName()
                            + " value is neither a Unix timestamp nor an ISO-8601 date/time ("
                            + e.getMessage() + ")");
                }
            default:
                accepted = true;
                break;
        }
        if (accepted) {
            return Optional.empty();
        }
        return Optional.of(value.getClass().getSimpleName() + " value does not match a " + kind
                + " column");
    }

    /**
     * Converts a timestamp-like value to a local date-time in this coercer's zone.
     *
     * <p>
     * Numbers and purely numeric text are Unix seconds. Signed values reach back before 1970;
     * fractions and exponents are allowed. Other text is parsed with
     * {@link FlexibleDateTimeParsers#ISO_DATE_OPTIONAL_TIME}; a date alone means midnight and an
     * explicit offset is shifted into this coercer's zone.
     * </p>
     *
     * @param value timestamp-like value
     * @return local date-time
     * @throws DateTimeException if text cannot be parsed or the instant is out of range
     * @throws IllegalArgumentException if the value type is not timestamp-like
     */
    public LocalDateTime toTimestamp(Object value) {
        Validate.notNull(value, "value must not be null");
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(zone).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(zone).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, zone);
        }
        if (value instanceof Number) {
            return fromUnixSeconds(new BigDecimal(value.toString()));
        }
        if (value instanceof CharSequence) {
            return parseTimestamp(value.toString().trim());
        }
        throw new IllegalArgumentException(
                "Unsupported timestamp value type: " + value.getClass().getName());
    }

    private LocalDateTime parseTimestamp(String text) {
        if (UNIX_SECONDS.matcher(text).matches()) {
            return fromUnixSeconds(new BigDecimal(text));
        }
        TemporalAccessor parsed = FlexibleDateTimeParsers.ISO_DATE_OPTIONAL_TIME.parseBest(text,
                OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).atZoneSameInstant(zone).toLocalDateTime();
        }
        if (parsed instanceof LocalDateTime) {
            return (LocalDateTime) parsed;
        }
        return ((LocalDate) parsed).atStartOfDay();
    }

    private LocalDateTime fromUnixSeconds(BigDecimal seconds) {
        BigDecimal[] parts = seconds.divideAndRemainder(BigDecimal.ONE);
        Instant instant = Instant.ofEpochSecond(parts[0].longValueExact(),
                parts[1].movePointRight(9).longValue());
        return LocalDateTime.ofInstant(instant, zone);
    }

    private static Number toInteger(String text) {
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            return new BigInteger(text);
        }
    }

    private static Boolean toBoolean(String text) {
        if (SIGNED_DECIMAL.matcher(text).matches()) {
            return new BigDecimal(text).signum() != 0;
        }
        return !FALSE_LITERALS.contains(text.toLowerCase(Locale.ROOT));
    }
}
