package org.rtbsa.core.buffer;

import java.util.Arrays;

/**
 * Fixed-capacity window of doubles, oldest first. NaN marks a missing sample.
 *
 * <p>Not thread-safe; {@link org.rtbsa.core.stream.SingleStream} guards it with its own lock.
 */
public final class RingBuffer {
    private final double[] data;
    private int head; // index of the oldest element

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.data = new double[capacity];
        Arrays.fill(data, Double.NaN);
    }

    public int capacity() {
        return data.length;
    }

    /** Evicts the oldest element and appends {@code value} as the newest. */
    public void push(double value) {
        data[head] = value;
        head = (head + 1) % data.length;
    }

    /** Evicts the {@code n} oldest elements and appends {@code n} NaN placeholders. */
    public void shift(int n) {
        if (n <= 0) return;
        if (n >= data.length) {
            Arrays.fill(data, Double.NaN);
            head = 0;
            return;
        }
        for (int i = 0; i < n; i++) push(Double.NaN);
    }

    /** Element at logical position {@code i}, 0 being the oldest. */
    public double get(int i) {
        if (i < 0 || i >= data.length) {
            throw new IndexOutOfBoundsException("index " + i + " out of [0, " + data.length + ")");
        }
        return data[(head + i) % data.length];
    }

    public double newest() {
        return get(data.length - 1);
    }

    /**
     * Replaces the contents. A short source is left-padded with NaN; a long one keeps its
     * newest {@code capacity()} values.
     */
    public void seed(double[] values) {
        Arrays.fill(data, Double.NaN);
        head = 0;
        if (values == null) return;
        int n = Math.min(values.length, data.length);
        System.arraycopy(values, values.length - n, data, data.length - n, n);
    }

    /** Independent copy, oldest first. */
    public double[] copy() {
        var out = new double[data.length];
        int tail = data.length - head;
        System.arraycopy(data, head, out, 0, tail);
        System.arraycopy(data, 0, out, tail, head);
        return out;
    }
}
