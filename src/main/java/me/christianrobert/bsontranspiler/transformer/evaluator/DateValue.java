package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * A point in time, stored as milliseconds since the epoch.
 * Fields are always read in UTC.
 */
public final class DateValue {

    private final long epochMillis;

    public DateValue(long epochMillis) {
        this.epochMillis = epochMillis;
    }

    public long getEpochMillis() {
        return epochMillis;
    }

    public ZonedDateTime toUtc() {
        return Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DateValue && ((DateValue) o).epochMillis == epochMillis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(epochMillis);
    }

    @Override
    public String toString() {
        return Instant.ofEpochMilli(epochMillis).toString();
    }
}
