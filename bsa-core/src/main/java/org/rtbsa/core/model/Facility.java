package org.rtbsa.core.model;

/**
 * Accelerator facility class; bounds the rate at which BSA buffers can fill.
 */
public enum Facility {
    NC(120.0),
    SC(102.0),
    F2(30.0);

    private final double maxRateHz;

    Facility(double maxRateHz) {
        this.maxRateHz = maxRateHz;
    }

    public double maxRateHz() {
        return maxRateHz;
    }
}
