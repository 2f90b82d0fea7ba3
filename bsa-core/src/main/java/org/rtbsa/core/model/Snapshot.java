package org.rtbsa.core.model;

import java.util.Arrays;

/**
 * Copy of a stream buffer, oldest first, paired with the pulse ID of its newest element.
 */
public record Snapshot(double[] values, int pulseId) {

    public int length() {
        return values.length;
    }

    /** The newest {@code n} values; {@code n} is clamped to the buffer length. */
    public double[] tail(int n) {
        int k = Math.max(0, Math.min(n, values.length));
        return Arrays.copyOfRange(values, values.length - k, values.length);
    }

    public int finiteCount() {
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) n++;
        }
        return n;
    }
}
