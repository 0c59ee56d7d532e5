package io.github.yok.sqlitevault.type;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import lombok.Generated;

/**
 * Shared permissive {@link DateTimeFormatter} used to read timestamp columns.
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexibleDateTimeParsers {

    /**
     * ISO-8601 parser accepting a date alone or a date followed by a time.
     *
     * <p>
     * The time may be separated by {@code 'T'} or a space; seconds, fractional seconds (up to
     * nanoseconds) and an offset ({@code Z}, {@code +09:00}) are optional. Use
     * {@link DateTimeFormatter#parseBest} to tell the resulting temporal types apart.
     * </p>
     */
    public static final DateTimeFormatter ISO_DATE_OPTIONAL_TIME =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .optionalStart()
                    .optionalStart().appendLiteral('T').optionalEnd()
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .appendValue(ChronoField.HOUR_OF_DAY, 2).appendLiteral(':')
                    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                    .optionalStart().appendLiteral(':')
                    .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                    .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                    .optionalEnd()
                    .optionalEnd()
                    .optionalStart().appendOffsetId().optionalEnd()
                    .optionalEnd()
                    .toFormatter(Locale.ROOT);

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private FlexibleDateTimeParsers() {}
}
