package gr.imsi.athenarc.uroflow.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

public class DateTimeUtil {

    public static final ZoneId UTC = ZoneId.of("UTC");
    public static final DateTimeFormatter ISO_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(UTC);
    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private DateTimeUtil() {}

    /**
     * Formats an epoch-millisecond timestamp as a UTC ISO-8601 string with milliseconds.
     */
    public static String formatIso(final long timeStamp) {
        return ISO_FORMATTER.format(Instant.ofEpochMilli(timeStamp));
    }

    public static String format(final long timeStamp, final DateTimeFormatter formatter, final ZoneId zone) {
        return Instant.ofEpochMilli(timeStamp)
                .atZone(zone)
                .format(formatter);
    }

    public static String formatDate(final LocalDate date) {
        return DATE_FORMATTER.format(date);
    }

    /**
     * Rounds a timestamp down to the closest multiple of {@code intervalMillis} since the epoch.
     */
    public static long floorToInterval(final long timeStamp, final long intervalMillis) {
        return Math.floorDiv(timeStamp, intervalMillis) * intervalMillis;
    }

    /**
     * Parses a timestamp given as an ISO-8601 instant or offset date-time, or as a local
     * date-time / date interpreted in {@code zoneId}.
     *
     * @throws DateTimeParseException if none of the formats match
     */
    public static long parseTimestamp(final String s, final ZoneId zoneId) {
        String value = s.trim();
        if (value.indexOf('T') < 0) {
            return LocalDate.parse(value).atStartOfDay(zoneId).toInstant().toEpochMilli();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toInstant().toEpochMilli();
        }
        return ((LocalDateTime) parsed).atZone(zoneId).toInstant().toEpochMilli();
    }
}
