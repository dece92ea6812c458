package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date construction for the {@code Date(...)} constructor.
 *
 * <p>Local time is UTC: strings without an offset and component arguments are read as UTC,
 * so folding does not depend on the host time zone.</p>
 */
public final class JsDates {

    public static final String INVALID_DATE = "Invalid Date";

    private static final double MAX_TIME = 8.64e15;

    // Largest year magnitude whose January 1st lies within MAX_TIME of the epoch
    private static final double MAX_YEAR = 275760;

    private static final Pattern ISO_DATE = Pattern.compile(
            "([+-]\\d{6}|\\d{4})(?:-(\\d{2})(?:-(\\d{2}))?)?"
                    + "(?:[T ](\\d{2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,9}))?)?)?"
                    + "(Z|[+-]\\d{2}:?\\d{2})?");

    private JsDates() {
    }

    /**
     * Milliseconds since the epoch for a single numeric argument.
     */
    public static long fromEpochMillis(double millis) {
        if (Double.isNaN(millis) || Math.abs(millis) > MAX_TIME) {
            throw new EvaluationException(INVALID_DATE);
        }
        return (long) millis;
    }

    /**
     * Milliseconds since the epoch for {@code Date(year, month[, day[, hours[, minutes[, seconds[, ms]]]]])}.
     * Months are zero based and overflow into the next unit. Years 0 to 99 mean 1900 to 1999.
     */
    public static long fromComponents(List<Double> components) {
        double[] fields = {Double.NaN, 0, 1, 0, 0, 0, 0};
        for (int i = 0; i < fields.length && i < components.size(); i++) {
            fields[i] = components.get(i);
        }
        for (double field : fields) {
            if (Double.isNaN(field) || Double.isInfinite(field)) {
                throw new EvaluationException(INVALID_DATE);
            }
        }

        if (Math.abs(fields[0]) > MAX_YEAR) {
            throw new EvaluationException(INVALID_DATE);
        }
        long year = (long) fields[0];
        if (year >= 0 && year <= 99) {
            year += 1900;
        }
        try {
            LocalDateTime dateTime = LocalDateTime.of((int) year, 1, 1, 0, 0)
                    .plusMonths((long) fields[1])
                    .plusDays((long) fields[2] - 1)
                    .plusHours((long) fields[3])
                    .plusMinutes((long) fields[4])
                    .plusSeconds((long) fields[5])
                    .plusNanos((long) fields[6] * 1_000_000L);
            return fromEpochMillis(dateTime.toInstant(ZoneOffset.UTC).toEpochMilli());
        } catch (DateTimeException | ArithmeticException e) {
            throw new EvaluationException(INVALID_DATE, e);
        }
    }

    /**
     * Parses an ISO 8601 date string (date only, or date and time with an optional offset)
     * or an RFC 1123 date such as {@code Tue, 3 Jun 2008 11:05:30 GMT}.
     */
    public static long parse(String text) {
        String trimmed = text.strip();
        Matcher m = ISO_DATE.matcher(trimmed);
        if (m.matches()) {
            return parseIso(m);
        }
        try {
            return fromEpochMillis(ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME)
                    .toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            throw new EvaluationException(INVALID_DATE, e);
        }
    }

    private static long parseIso(Matcher m) {
        try {
            int year = Integer.parseInt(m.group(1));
            int month = m.group(2) != null ? Integer.parseInt(m.group(2)) : 1;
            int day = m.group(3) != null ? Integer.parseInt(m.group(3)) : 1;
            LocalDate date = LocalDate.of(year, month, day);

            LocalTime time = LocalTime.MIDNIGHT;
            if (m.group(4) != null) {
                int hour = Integer.parseInt(m.group(4));
                int minute = Integer.parseInt(m.group(5));
                int second = m.group(6) != null ? Integer.parseInt(m.group(6)) : 0;
                int nanos = 0;
                if (m.group(7) != null) {
                    String fraction = (m.group(7) + "000000000").substring(0, 9);
                    nanos = Integer.parseInt(fraction.substring(0, 3)) * 1_000_000;
                }
                if (hour == 24 && minute == 0 && second == 0 && nanos == 0) {
                    date = date.plusDays(1);
                } else {
                    time = LocalTime.of(hour, minute, second, nanos);
                }
            }

            ZoneOffset offset = ZoneOffset.UTC;
            String zone = m.group(8);
            if (zone != null && !zone.equals("Z")) {
                offset = ZoneOffset.of(zone.length() == 5 ? zone.substring(0, 3) + ":" + zone.substring(3) : zone);
            }
            return fromEpochMillis(date.atTime(time).toInstant(offset).toEpochMilli());
        } catch (DateTimeException | NumberFormatException e) {
            throw new EvaluationException(INVALID_DATE, e);
        }
    }
}
