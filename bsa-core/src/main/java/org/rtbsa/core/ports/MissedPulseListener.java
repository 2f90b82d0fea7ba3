package org.rtbsa.core.ports;

import org.rtbsa.core.model.MissedPulseEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observability sink for gaps in a stream. Called on the update delivery thread, so
 * implementations must return quickly.
 */
@FunctionalInterface
public interface MissedPulseListener {

    MissedPulseListener NO_OP = event -> { };

    MissedPulseListener LOGGING = new MissedPulseListener() {
        private final Logger log = LoggerFactory.getLogger(MissedPulseListener.class);

        @Override
        public void onMissedPulses(MissedPulseEvent e) {
            log.info("{} missed {} pulses: {}->{}", e.channel(), e.missed(), e.lastPulseId(), e.newPulseId());
        }
    };

    void onMissedPulses(MissedPulseEvent event);

    default MissedPulseListener andThen(MissedPulseListener next) {
        return event -> {
            onMissedPulses(event);
            next.onMissedPulses(event);
        };
    }
}
