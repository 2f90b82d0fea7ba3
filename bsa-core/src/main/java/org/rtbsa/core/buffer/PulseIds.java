package org.rtbsa.core.buffer;

/**
 * Pulse ID arithmetic. A pulse ID is the low 14 bits of the nanoseconds field of a BSA timestamp
 * and counts 360 Hz fiducials, wrapping at 2^14.
 */
public final class PulseIds {
    public static final int BITS = 14;
    public static final int MODULUS = 1 << BITS;
    public static final int MASK = MODULUS - 1;

    public static final double FIDUCIAL_RATE_HZ = 360.0;
    public static final int BUFFER_LENGTH = 2800;

    private PulseIds() {
    }

    public static int fromNanos(long nanos) {
        return (int) (nanos & MASK);
    }

    /** Replaces the low 14 bits of {@code nanos} with {@code pulseId}. */
    public static long stamp(long nanos, int pulseId) {
        return (nanos & ~((long) MASK)) | (pulseId & MASK);
    }

    /** Non-negative remainder modulo 2^14; fractional ids (non-integer tick spacing) are kept. */
    public static double wrap(double pulseId) {
        double r = pulseId % MODULUS;
        return r < 0 ? r + MODULUS : r;
    }

    public static int wrap(int pulseId) {
        return Math.floorMod(pulseId, MODULUS);
    }

    /**
     * Signed distance from {@code from} to {@code to} across the wrap, in {@code [-2^13, 2^13)}.
     * E.g. {@code distance(16380, 14) == 18} and {@code distance(16382, 16382) == 0}.
     */
    public static double distance(double from, double to) {
        double half = MODULUS / 2.0;
        return wrap(to - from + half) - half;
    }
}
