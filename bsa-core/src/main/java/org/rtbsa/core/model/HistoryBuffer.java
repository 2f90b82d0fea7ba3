package org.rtbsa.core.model;

/**
 * Contents of a history buffer PV, oldest first, and the timestamp of its newest element.
 */
public record HistoryBuffer(double[] values, long timestampNanos) {
}
