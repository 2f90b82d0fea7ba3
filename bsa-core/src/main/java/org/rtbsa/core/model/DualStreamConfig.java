package org.rtbsa.core.model;

import org.rtbsa.core.error.ConfigurationException;

/**
 * Two channels streamed on the same beamline.
 */
public record DualStreamConfig(String ch1, String ch2, Beamline beamline) {

    public DualStreamConfig {
        if (beamline == null) {
            throw new ConfigurationException("beamline must be set");
        }
        ch1 = new StreamConfig(ch1, beamline).channel();
        ch2 = new StreamConfig(ch2, beamline).channel();
    }

    public static DualStreamConfig of(String ch1, String ch2, String beamline) {
        return new DualStreamConfig(ch1, ch2, Beamline.parse(beamline));
    }

    public StreamConfig first() {
        return new StreamConfig(ch1, beamline);
    }

    public StreamConfig second() {
        return new StreamConfig(ch2, beamline);
    }

    public DualStreamConfig withCh1(String ch1) {
        return new DualStreamConfig(ch1, ch2, beamline);
    }

    public DualStreamConfig withCh2(String ch2) {
        return new DualStreamConfig(ch1, ch2, beamline);
    }

    public DualStreamConfig withBeamline(Beamline beamline) {
        return new DualStreamConfig(ch1, ch2, beamline);
    }
}
