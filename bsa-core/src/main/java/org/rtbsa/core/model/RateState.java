package org.rtbsa.core.model;

import org.rtbsa.core.buffer.PulseIds;

/**
 * Effective sample rate of a stream and the timing constants derived from it.
 *
 * @param sampleRate     reported rate clamped to the facility maximum (Hz)
 * @param sampleSpacing  seconds between samples
 * @param ticksPerSample pulse ID increment per buffer update
 * @param bufferModulus  samples counted before the pulse ID wraps
 */
public record RateState(double sampleRate, double sampleSpacing, double ticksPerSample, double bufferModulus) {

    public static final RateState UNDEFINED = new RateState(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    /**
     * Zero, negative or NaN ("no beam") leaves every derived quantity NaN.
     */
    public static RateState of(double reportedRate, double facilityMaxRate) {
        double rate = Math.min(reportedRate, facilityMaxRate);
        if (Double.isNaN(reportedRate) || reportedRate <= 0.0) {
            return new RateState(rate, Double.NaN, Double.NaN, Double.NaN);
        }
        double ticks = PulseIds.FIDUCIAL_RATE_HZ / rate;
        return new RateState(rate, 1.0 / rate, ticks, Math.floor(PulseIds.MODULUS / ticks));
    }

    public boolean isDefined() {
        return !Double.isNaN(ticksPerSample);
    }
}
