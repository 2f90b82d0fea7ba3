package org.rtbsa.core.model;

/**
 * Emitted when an update arrives more than one sample period after the previous one.
 * Informational only; the gap has already been padded with NaN.
 */
public record MissedPulseEvent(String channel, int missed, int lastPulseId, int newPulseId) {
}
