package org.rtbsa.core.model;

import java.util.List;

/**
 * Registry entry describing an open stream.
 */
public record StreamInfo(String id, String kind, List<String> channels, Beamline beamline, boolean usable) {
}
