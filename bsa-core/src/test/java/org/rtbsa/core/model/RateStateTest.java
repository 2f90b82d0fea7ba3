package org.rtbsa.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RateStateTest {

    @Test
    void sixtyHertzAtNcGivesSixTicksPerSample() {
        var r = RateState.of(60.0, Facility.NC.maxRateHz());
        assertThat(r.sampleRate()).isEqualTo(60.0);
        assertThat(r.ticksPerSample()).isEqualTo(6.0);
        assertThat(r.bufferModulus()).isEqualTo(2730.0);
        assertThat(r.sampleSpacing()).isCloseTo(1.0 / 60.0, within(1e-12));
        assertThat(r.isDefined()).isTrue();
    }

    @Test
    void clampsToFacilityMaximum() {
        var r = RateState.of(1000.0, Facility.SC.maxRateHz());
        assertThat(r.sampleRate()).isEqualTo(102.0);
        assertThat(r.ticksPerSample()).isCloseTo(360.0 / 102.0, within(1e-12));
        assertThat(r.bufferModulus()).isEqualTo(Math.floor(16384 / (360.0 / 102.0)));
    }

    @Test
    void noBeamLeavesDerivedQuantitiesUndefined() {
        for (double v : new double[]{0.0, -1.0, Double.NaN}) {
            var r = RateState.of(v, 120.0);
            assertThat(r.sampleSpacing()).isNaN();
            assertThat(r.ticksPerSample()).isNaN();
            assertThat(r.bufferModulus()).isNaN();
            assertThat(r.isDefined()).isFalse();
        }
        assertThat(RateState.UNDEFINED.isDefined()).isFalse();
    }
}
