package win.ixuni.quarry.core.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * HTTP-date helpers (RFC 7231 IMF-fixdate; RFC 850 and asctime accepted on input)
 */
public final class HttpDates {

    private static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
            .withZone(ZoneOffset.UTC);

    /**
     * Obsolete RFC 850 form, still accepted on input
     */
    private static final DateTimeFormatter RFC_850_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("EEEE, dd-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1970)
            .appendPattern(" HH:mm:ss 'GMT'")
            .toFormatter(Locale.US)
            .withZone(ZoneOffset.UTC);

    /**
     * asctime() form, e.g. {@code Sun Nov  6 08:49:37 1994}; whitespace is collapsed before parsing
     */
    private static final DateTimeFormatter ASCTIME_FORMATTER = DateTimeFormatter
            .ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US)
            .withZone(ZoneOffset.UTC);

    private HttpDates() {
    }

    public static String format(Instant instant) {
        return HTTP_DATE_FORMATTER.format(instant);
    }

    /**
     * Parse an HTTP date header value
     *
     * @return the instant, or null when the value is absent or not a valid HTTP date
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // fall through
        }
        try {
            return ZonedDateTime.parse(trimmed, RFC_850_FORMATTER).toInstant();
        } catch (DateTimeParseException e) {
            // fall through
        }
        try {
            return ZonedDateTime.parse(trimmed.replaceAll("\\s+", " "), ASCTIME_FORMATTER).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * HTTP dates carry whole seconds; comparisons against stored timestamps drop the fraction
     */
    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }
}
