package org.rtbsa.core.model;

import java.util.Arrays;

/**
 * Time-aligned overlap of two stream buffers. Row {@code a[i]} and {@code b[i]} come from the same
 * beam pulse, oldest first; {@code a} and {@code b} always have the same length.
 *
 * @param latestSyncedPulseId smaller of the two newest pulse IDs
 * @param offset              resolved lag in samples; positive when the first stream lags
 */
public record AlignedSnapshot(double[] a, double[] b, int latestSyncedPulseId, int offset) {

    public AlignedSnapshot {
        if (a.length != b.length) {
            throw new IllegalArgumentException("rows differ in length: " + a.length + " vs " + b.length);
        }
    }

    public static AlignedSnapshot empty(int latestSyncedPulseId, int offset) {
        return new AlignedSnapshot(new double[0], new double[0], latestSyncedPulseId, offset);
    }

    public int syncedPointCount() {
        return a.length;
    }

    /** Both rows as a 2 x N array. */
    public double[][] rows() {
        return new double[][]{a, b};
    }

    /** The newest {@code n} aligned pairs. */
    public AlignedSnapshot tail(int n) {
        int k = Math.max(0, Math.min(n, a.length));
        return new AlignedSnapshot(
                Arrays.copyOfRange(a, a.length - k, a.length),
                Arrays.copyOfRange(b, b.length - k, b.length),
                latestSyncedPulseId, offset);
    }

    /** Pairs where both values are present. */
    public int finitePairCount() {
        int n = 0;
        for (int i = 0; i < a.length; i++) {
            if (!Double.isNaN(a[i]) && !Double.isNaN(b[i])) n++;
        }
        return n;
    }
}
