package org.rtbsa.core.model;

/**
 * One time-stamped scalar update delivered by a subscription.
 */
public record Sample(String channel, double value, long timestampNanos) {
}
