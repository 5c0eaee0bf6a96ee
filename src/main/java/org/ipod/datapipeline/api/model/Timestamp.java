package org.ipod.datapipeline.api.model;

import java.util.Comparator;

/**
 * A point in time expressed as a Modified Julian Date day number plus nanoseconds into that day.
 * <p>
 * Ordering is by {@code days} first, then {@code nanos}, which matches the sort order used
 * for observations and observers.
 *
 * @param days  MJD day number.
 * @param nanos Nanoseconds elapsed since the start of the day, in {@code [0, NANOS_PER_DAY)}.
 */
public record Timestamp(long days, long nanos) implements Comparable<Timestamp> {

    public static final long NANOS_PER_DAY = 86_400_000_000_000L;

    private static final Comparator<Timestamp> ORDER =
            Comparator.comparingLong(Timestamp::days).thenComparingLong(Timestamp::nanos);

    public Timestamp {
        if (nanos < 0 || nanos >= NANOS_PER_DAY) {
            throw new IllegalArgumentException("nanos must be within one day, got " + nanos);
        }
    }

    /**
     * Creates a timestamp from a fractional MJD.
     *
     * @param mjd The fractional Modified Julian Date.
     * @return The equivalent timestamp, rounded to the nearest nanosecond.
     */
    public static Timestamp fromMjd(double mjd) {
        long days = (long) Math.floor(mjd);
        long nanos = Math.round((mjd - days) * NANOS_PER_DAY);
        if (nanos >= NANOS_PER_DAY) {
            days += 1;
            nanos -= NANOS_PER_DAY;
        }
        return new Timestamp(days, nanos);
    }

    /**
     * @return This timestamp as a fractional MJD.
     */
    public double mjd() {
        return days + (double) nanos / NANOS_PER_DAY;
    }

    @Override
    public int compareTo(Timestamp other) {
        return ORDER.compare(this, other);
    }
}
