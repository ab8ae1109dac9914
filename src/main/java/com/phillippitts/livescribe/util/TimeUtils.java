package com.phillippitts.livescribe.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since {@code startNanos}.
     *
     * @param startNanos value previously read from {@link System#nanoTime()}
     * @return elapsed milliseconds, truncated
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}
