package io.providerbridge.core;

/**
 * Timestamp with nanosecond precision, split into whole seconds and the nanosecond remainder.
 *
 * <p>Ordering is by {@code sec} and then {@code nsec}. The bridge never normalizes or clamps a
 * range built from two instances; a {@code start} after its {@code end} is passed through as is.
 */
public record Time(long sec, long nsec) implements Comparable<Time> {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    public Time {
        if (nsec < 0 || nsec >= NANOS_PER_SECOND) {
            throw new IllegalArgumentException("nsec must be in [0, 1e9): " + nsec);
        }
    }

    public static Time ofNanos(long nanos) {
        return new Time(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    public long toNanos() {
        return Math.addExact(Math.multiplyExact(sec, NANOS_PER_SECOND), nsec);
    }

    @Override
    public int compareTo(Time o) {
        int c = Long.compare(sec, o.sec);
        return c != 0 ? c : Long.compare(nsec, o.nsec);
    }

    @Override
    public String toString() {
        return sec + "." + String.format("%09d", nsec);
    }
}
