package org.rtbsa.core.model;

import org.rtbsa.core.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deployment context of a stream: which beam rate to follow and how the history buffers are named.
 */
public enum Beamline {
    NC_SXR(Facility.NC, "EVNT:SYS0:1:NC_SOFTRATE", "HSTCUS"),
    NC_HXR(Facility.NC, "EVNT:SYS0:1:NC_HARDRATE", "HSTCUH"),
    SC_BSYD(Facility.SC, "TPG:SYS0:1:DST02:RATE_RBV", "HSTSCD"),
    SC_SXR(Facility.SC, "TPG:SYS0:1:DST04:RATE_RBV", "HSTSCS"),
    SC_HXR(Facility.SC, "TPG:SYS0:1:DST03:RATE_RBV", "HSTSCH"),
    F2(Facility.F2, "EVNT:SYS1:1:BEAMRATE", "HST");

    /** Below this rate the one-Hz history buffer fills fastest. */
    static final double TEN_HZ = 10.0;

    private final Facility facility;
    private final String rateSourceAddress;
    private final String historyEdef;

    Beamline(Facility facility, String rateSourceAddress, String historyEdef) {
        this.facility = facility;
        this.rateSourceAddress = rateSourceAddress;
        this.historyEdef = historyEdef;
    }

    public static Beamline parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("beamline must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + " is not a valid beamline, expected one of "
                    + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
        }
    }

    public Facility facility() {
        return facility;
    }

    public double maxRateHz() {
        return facility.maxRateHz();
    }

    public String rateSourceAddress() {
        return rateSourceAddress;
    }

    public String historyEdef() {
        return historyEdef;
    }

    /**
     * History buffer suffix for the buffer that populates fastest at {@code rateHz}.
     * An undefined rate falls into the one-Hz bucket.
     */
    public String historySuffix(double rateHz) {
        if (rateHz >= facility.maxRateHz()) {
            return facility == Facility.SC ? "HH" : "BR";
        }
        if (rateHz >= TEN_HZ) return "TH";
        return "1H";
    }

    public String historyAddress(String channel, double rateHz) {
        return channel + historyEdef + historySuffix(rateHz);
    }
}
