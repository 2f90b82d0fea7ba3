package org.rtbsa.service;

import io.micrometer.core.instrument.MeterRegistry;
import org.rtbsa.core.model.MissedPulseEvent;
import org.rtbsa.core.ports.MissedPulseListener;

/**
 * Counts missed pulses per channel in {@code bsa_missed_pulses}, then logs the gap.
 */
public class MissedPulseMetrics implements MissedPulseListener {
    private final MeterRegistry registry;
    private final MissedPulseListener next;

    public MissedPulseMetrics(MeterRegistry registry) {
        this(registry, MissedPulseListener.LOGGING);
    }

    MissedPulseMetrics(MeterRegistry registry, MissedPulseListener next) {
        this.registry = registry;
        this.next = next;
    }

    @Override
    public void onMissedPulses(MissedPulseEvent event) {
        registry.counter("bsa_missed_pulses", "channel", event.channel()).increment(event.missed());
        next.onMissedPulses(event);
    }
}
