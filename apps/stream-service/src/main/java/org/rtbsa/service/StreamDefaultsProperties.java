package org.rtbsa.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rtbsa.streams")
public class StreamDefaultsProperties {
    private String beamline = "NC_HXR"; // used when a request names none
    private int window = 1000;          // points returned when a read names no n

    public String getBeamline() {
        return beamline;
    }

    public void setBeamline(String beamline) {
        this.beamline = beamline;
    }

    public int getWindow() {
        return window;
    }

    public void setWindow(int window) {
        this.window = window;
    }
}
