package org.rtbsa.core.model;

import org.rtbsa.core.error.ConfigurationException;

/**
 * Channel (BSA PV address without event definition) and beamline of a single stream.
 */
public record StreamConfig(String channel, Beamline beamline) {

    public StreamConfig {
        if (channel == null || channel.isBlank()) {
            throw new ConfigurationException("channel must not be blank");
        }
        if (beamline == null) {
            throw new ConfigurationException("beamline must be set");
        }
        channel = channel.trim();
    }

    public static StreamConfig of(String channel, String beamline) {
        return new StreamConfig(channel, Beamline.parse(beamline));
    }

    public StreamConfig withChannel(String channel) {
        return new StreamConfig(channel, beamline);
    }

    public StreamConfig withBeamline(Beamline beamline) {
        return new StreamConfig(channel, beamline);
    }
}
