package com.kotsin.crossimpact.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GridAligner - Aligns timestamps to the common calendar grid shared by all symbols.
 *
 * Grid points are whole multiples of the bin width since the Unix epoch (UTC), so two
 * symbols with the same bin width always land on the same points.
 */
public final class GridAligner {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private GridAligner() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Latest grid point at or before {@code timestamp}.
     */
    public static Instant alignDown(Instant timestamp, Duration binWidth) {
        long step = stepNanos(binWidth);
        long nanos = epochNanos(timestamp);
        return fromEpochNanos(Math.floorDiv(nanos, step) * step);
    }

    /**
     * Earliest grid point at or after {@code timestamp}.
     */
    public static Instant alignUp(Instant timestamp, Duration binWidth) {
        Instant down = alignDown(timestamp, binWidth);
        return down.equals(timestamp) ? down : down.plus(binWidth);
    }

    /**
     * Label of the bin (t, t + binWidth] that contains {@code timestamp}: the grid point
     * strictly before it.
     */
    public static Instant binStartExclusive(Instant timestamp, Duration binWidth) {
        return alignUp(timestamp, binWidth).minus(binWidth);
    }

    public static boolean isOnGrid(Instant timestamp, Duration binWidth) {
        return alignDown(timestamp, binWidth).equals(timestamp);
    }

    /**
     * Grid points from {@code start} to {@code end}, both inclusive. Both must be on the grid.
     */
    public static List<Instant> gridPoints(Instant start, Instant end, Duration binWidth) {
        if (!isOnGrid(start, binWidth) || !isOnGrid(end, binWidth)) {
            throw new IllegalArgumentException("Window [" + start + ", " + end + "] is not aligned to " + binWidth);
        }
        List<Instant> points = new ArrayList<>();
        for (Instant t = start; !t.isAfter(end); t = t.plus(binWidth)) {
            points.add(t);
        }
        return points;
    }

    private static long stepNanos(Duration binWidth) {
        if (binWidth == null || binWidth.isZero() || binWidth.isNegative()) {
            throw new IllegalArgumentException("Bin width must be positive: " + binWidth);
        }
        return binWidth.toNanos();
    }

    private static long epochNanos(Instant timestamp) {
        return Math.addExact(Math.multiplyExact(timestamp.getEpochSecond(), NANOS_PER_SECOND), timestamp.getNano());
    }

    private static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }
}
